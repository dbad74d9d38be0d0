package net.pgtyped.client.jdbc;

import net.pgtyped.client.core.ExecStatus;

/**
 * The backend reported a non-success status together with a SQL state code and a message. {@link
 * #getSQLState()} returns the backend's code so callers can match on it.
 */
public class PgSqlStateException extends PgSQLException {
  private static final long serialVersionUID = 1L;

  private final ExecStatus status;
  private final String backendMessage;

  public PgSqlStateException(ExecStatus status, String sqlStateCode, String backendMessage) {
    super(
        sqlStateCode, ErrorCode.SQL_ERROR, sqlStateCode, status.getDescription(), backendMessage);
    this.status = status;
    this.backendMessage = backendMessage;
  }

  public ExecStatus getStatus() {
    return status;
  }

  /**
   * @return the backend's error message as reported, without the code prefix
   */
  public String getBackendMessage() {
    return backendMessage;
  }
}
