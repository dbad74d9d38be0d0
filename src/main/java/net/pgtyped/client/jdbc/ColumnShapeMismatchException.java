package net.pgtyped.client.jdbc;

/**
 * The result reports a column count different from the width the row decoder was built for.
 * Usually means the statement and the decoder drifted apart.
 */
public class ColumnShapeMismatchException extends PgSQLException {
  private static final long serialVersionUID = 1L;

  private final String operation;
  private final int actualColumns;
  private final int expectedColumns;

  public ColumnShapeMismatchException(String operation, int actualColumns, int expectedColumns) {
    super(
        ErrorCode.COLUMN_SHAPE_MISMATCH,
        operation,
        String.valueOf(actualColumns),
        String.valueOf(expectedColumns));
    this.operation = operation;
    this.actualColumns = actualColumns;
    this.expectedColumns = expectedColumns;
  }

  public String getOperation() {
    return operation;
  }

  public int getActualColumns() {
    return actualColumns;
  }

  public int getExpectedColumns() {
    return expectedColumns;
  }
}
