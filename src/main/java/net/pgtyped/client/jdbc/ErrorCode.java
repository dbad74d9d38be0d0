package net.pgtyped.client.jdbc;

import java.util.HashMap;
import java.util.Map;
import net.pgtyped.common.core.SqlState;

/** Client-side error codes for typed result access. */
public enum ErrorCode {
  /*
   * Error codes partitioning:
   *
   * 3000NN: result access errors raised by the client
   */
  ROWS_OUT_OF_BOUNDS(300001, SqlState.INVALID_PARAMETER_VALUE),
  COLUMN_SHAPE_MISMATCH(300002, SqlState.DATATYPE_MISMATCH),
  ROW_DECODE_ERROR(300003, SqlState.DATA_EXCEPTION),
  CONNECTION_ERROR(300004, SqlState.CONNECTION_EXCEPTION),
  SQL_ERROR(300005, SqlState.INTERNAL_ERROR);

  public static final String errorMessageResource =
      "net.pgtyped.client.jdbc.result_error_messages";

  private final int messageCode;

  private final String sqlState;

  ErrorCode(int messageCode, String sqlState) {
    this.messageCode = messageCode;
    this.sqlState = sqlState;
  }

  public int getMessageCode() {
    return messageCode;
  }

  /**
   * Default SQL state for this error. {@link #SQL_ERROR} exceptions report the backend's state
   * instead.
   *
   * @return SQLSTATE code
   */
  public String getSqlState() {
    return sqlState;
  }

  @Override
  public String toString() {
    return "ErrorCode{" + "messageCode=" + messageCode + ", sqlState=" + sqlState + '}';
  }

  private static final Map<Integer, ErrorCode> errorCodeMap = new HashMap<>();

  static {
    for (ErrorCode errorCode : ErrorCode.values()) {
      errorCodeMap.put(errorCode.getMessageCode(), errorCode);
    }
  }

  /**
   * Look up an error code by its vendor code.
   *
   * @param messageCode vendor code
   * @return the error code, or null if unknown
   */
  public static ErrorCode fromMessageCode(int messageCode) {
    return errorCodeMap.get(messageCode);
  }
}
