package net.pgtyped.client.jdbc;

/** A row index outside {@code [0, ntuples)} was requested. */
public class RowsOutOfBoundsException extends PgSQLException {
  private static final long serialVersionUID = 1L;

  private final String operation;
  private final int requestedIndex;
  private final int totalRows;

  public RowsOutOfBoundsException(String operation, int requestedIndex, int totalRows) {
    super(
        ErrorCode.ROWS_OUT_OF_BOUNDS,
        operation,
        String.valueOf(requestedIndex),
        String.valueOf(totalRows));
    this.operation = operation;
    this.requestedIndex = requestedIndex;
    this.totalRows = totalRows;
  }

  public String getOperation() {
    return operation;
  }

  public int getRequestedIndex() {
    return requestedIndex;
  }

  public int getTotalRows() {
    return totalRows;
  }
}
