package net.pgtyped.client.core;

import net.pgtyped.client.jdbc.PgSQLException;

/** Carries a {@link PgSQLException} out of an {@link java.util.Iterator} or stream. */
public class ResultIterationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ResultIterationException(PgSQLException cause) {
    super(cause.getMessage(), cause);
  }

  /**
   * @return the failure raised while decoding a row
   */
  public PgSQLException getSQLException() {
    return (PgSQLException) super.getCause();
  }
}
