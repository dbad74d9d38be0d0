package net.pgtyped.client.core;

/**
 * Fully materialized result of one statement, owned by the driver. Implementations are read-only
 * once produced; the driver layer releases them after every reader is done.
 *
 * <p>Every byte array accessor returns null when the driver has no value. An empty array is a
 * value.
 */
public interface RawResult {
  /** @return number of rows */
  int ntuples();

  /** @return number of columns of every row */
  int nfields();

  /**
   * @param row zero-based row number
   * @param column zero-based column number
   * @return raw cell bytes, or null for SQL NULL
   */
  byte[] getValue(int row, int column);

  ExecStatus resultStatus();

  /** @return command tag, e.g. {@code INSERT 0 3} */
  byte[] cmdStatus();

  /** @return affected row count as text; empty when the command does not report one */
  byte[] cmdTuples();

  byte[] resultErrorMessage();

  byte[] resultErrorField(DiagField field);
}
