package net.pgtyped.client.jdbc;

/**
 * A driver metadata or diagnostic call returned no value where the backend always supplies one.
 * This points at a broken connection or driver, not at the statement.
 */
public class PgConnectionException extends PgSQLException {
  private static final long serialVersionUID = 1L;

  private final String call;

  /**
   * @param call name of the driver call that returned nothing
   */
  public PgConnectionException(String call) {
    super(ErrorCode.CONNECTION_ERROR, call);
    this.call = call;
  }

  public String getCall() {
    return call;
  }
}
