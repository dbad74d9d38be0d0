package net.pgtyped.client.jdbc;

/** The row decoder rejected the cells of a row. */
public class RowDecodeException extends PgSQLException {
  private static final long serialVersionUID = 1L;

  private final String operation;
  private final String decodeMessage;

  public RowDecodeException(String operation, String decodeMessage) {
    super(ErrorCode.ROW_DECODE_ERROR, operation, decodeMessage);
    this.operation = operation;
    this.decodeMessage = decodeMessage;
  }

  public String getOperation() {
    return operation;
  }

  /**
   * @return the decoder's failure message, unchanged
   */
  public String getDecodeMessage() {
    return decodeMessage;
  }
}
