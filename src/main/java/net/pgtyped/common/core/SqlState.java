package net.pgtyped.common.core;

/**
 * SQLSTATE codes used by the client for errors it raises itself. Backend-reported errors carry
 * their own code verbatim.
 *
 * <p>See https://www.postgresql.org/docs/current/errcodes-appendix.html
 */
public final class SqlState {
  // Class 08 - Connection Exception
  public static final String CONNECTION_EXCEPTION = "08000";

  // Class 22 - Data Exception
  public static final String DATA_EXCEPTION = "22000";
  public static final String INVALID_PARAMETER_VALUE = "22023";

  // Class 42 - Syntax Error or Access Rule Violation
  public static final String DATATYPE_MISMATCH = "42804";

  // Class XX - Internal Error
  public static final String INTERNAL_ERROR = "XX000";

  private SqlState() {}
}
