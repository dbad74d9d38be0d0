package net.pgtyped.client.core;

/** Result status reported by the backend for the command that produced a result. */
public enum ExecStatus {
  EMPTY_QUERY(0, "PGRES_EMPTY_QUERY"),
  COMMAND_OK(1, "PGRES_COMMAND_OK"),
  TUPLES_OK(2, "PGRES_TUPLES_OK"),
  COPY_OUT(3, "PGRES_COPY_OUT"),
  COPY_IN(4, "PGRES_COPY_IN"),
  BAD_RESPONSE(5, "PGRES_BAD_RESPONSE"),
  NONFATAL_ERROR(6, "PGRES_NONFATAL_ERROR"),
  FATAL_ERROR(7, "PGRES_FATAL_ERROR"),
  COPY_BOTH(8, "PGRES_COPY_BOTH"),
  SINGLE_TUPLE(9, "PGRES_SINGLE_TUPLE"),
  PIPELINE_SYNC(10, "PGRES_PIPELINE_SYNC"),
  PIPELINE_ABORTED(11, "PGRES_PIPELINE_ABORTED");

  private final int value;
  private final String description;

  ExecStatus(int value, String description) {
    this.value = value;
    this.description = description;
  }

  public int getValue() {
    return this.value;
  }

  public String getDescription() {
    return this.description;
  }

  /**
   * Whether the command completed successfully, with or without rows.
   *
   * @return true for COMMAND_OK and TUPLES_OK
   */
  public boolean isSuccess() {
    return this == COMMAND_OK || this == TUPLES_OK;
  }

  /**
   * Map a numeric libpq status to the enum.
   *
   * @param value numeric status
   * @return the status, or null if the value is unknown
   */
  public static ExecStatus fromValue(int value) {
    for (ExecStatus status : ExecStatus.values()) {
      if (status.value == value) {
        return status;
      }
    }
    return null;
  }
}
