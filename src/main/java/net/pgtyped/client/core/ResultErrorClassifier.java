package net.pgtyped.client.core;

import static net.pgtyped.client.util.PQUtil.decodeUtf8;

import java.util.Optional;
import net.pgtyped.client.jdbc.PgConnectionException;
import net.pgtyped.client.jdbc.PgSQLException;
import net.pgtyped.client.jdbc.PgSqlStateException;
import net.pgtyped.client.log.PQLogger;
import net.pgtyped.client.log.PQLoggerFactory;

/**
 * Turns the status and diagnostic fields of a raw result into a structured failure.
 *
 * <p>A well-behaved backend always sends both a SQL state and a message with an error. If either
 * is missing the driver or connection is broken, which is reported as {@link
 * PgConnectionException} so callers can tell it apart from an error in their statement.
 */
public class ResultErrorClassifier {
  private static final PQLogger logger = PQLoggerFactory.getLogger(ResultErrorClassifier.class);

  static final String RESULT_ERROR_FIELD_CALL = "resultErrorField";
  static final String RESULT_ERROR_MESSAGE_CALL = "resultErrorMessage";

  private ResultErrorClassifier() {}

  /**
   * Check that the result's status is COMMAND_OK or TUPLES_OK.
   *
   * @param result raw result
   * @throws PgConnectionException if the SQL state or the message is unavailable
   * @throws PgSqlStateException if the backend reported an error
   */
  public static void okResult(RawResult result) throws PgSQLException {
    ExecStatus status = result.resultStatus();
    if (status != null && status.isSuccess()) {
      return;
    }

    byte[] stateCode = result.resultErrorField(DiagField.SQLSTATE);
    if (stateCode == null) {
      logger.debug("Result with status {} has no SQL state", status);
      throw new PgConnectionException(RESULT_ERROR_FIELD_CALL);
    }

    byte[] message = result.resultErrorMessage();
    if (message == null) {
      logger.debug("Result with status {} has no error message", status);
      throw new PgConnectionException(RESULT_ERROR_MESSAGE_CALL);
    }

    if (logger.isDebugEnabled()) {
      logger.debug("Statement failed: {}", describe(result));
    }
    throw new PgSqlStateException(
        status == null ? ExecStatus.BAD_RESPONSE : status,
        decodeUtf8(stateCode),
        decodeUtf8(message));
  }

  /**
   * @param result raw result
   * @return the error message of the result, if the driver has one
   */
  public static Optional<byte[]> resultErrorMessage(RawResult result) {
    return Optional.ofNullable(result.resultErrorMessage());
  }

  /**
   * @param result raw result
   * @return the SQL state code of the result, if the driver has one
   * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">error codes</a>
   */
  public static Optional<byte[]> resultErrorCode(RawResult result) {
    return resultErrorField(result, DiagField.SQLSTATE);
  }

  public static Optional<byte[]> resultErrorField(RawResult result, DiagField field) {
    return Optional.ofNullable(result.resultErrorField(field));
  }

  /**
   * One line summary of a result's status and diagnostics, for logs. Never throws.
   *
   * @param result raw result
   * @return summary text
   */
  public static String describe(RawResult result) {
    StringBuilder builder = new StringBuilder();
    try {
      ExecStatus status = result.resultStatus();
      builder.append("status=").append(status == null ? "unknown" : status.getDescription());
      appendField(builder, "sqlState", result, DiagField.SQLSTATE);
      appendField(builder, "severity", result, DiagField.SEVERITY_NONLOCALIZED);
      appendField(builder, "message", result, DiagField.MESSAGE_PRIMARY);
      appendField(builder, "detail", result, DiagField.MESSAGE_DETAIL);
      appendField(builder, "hint", result, DiagField.MESSAGE_HINT);
    } catch (RuntimeException ex) {
      builder.append(" <unreadable: ").append(ex.getMessage()).append(">");
    }
    return builder.toString();
  }

  private static void appendField(
      StringBuilder builder, String label, RawResult result, DiagField field) {
    byte[] value = result.resultErrorField(field);
    if (value != null) {
      builder.append(", ").append(label).append("=").append(decodeUtf8(value));
    }
  }
}
