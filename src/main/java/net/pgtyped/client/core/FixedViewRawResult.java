package net.pgtyped.client.core;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Raw result held entirely in memory. Useful when rows come from somewhere other than the driver,
 * e.g. a client-side view or a test fixture.
 *
 * <p>Immutable: cells are copied when added and when read.
 */
public final class FixedViewRawResult implements RawResult {
  private final int numFields;
  private final List<byte[][]> rows;
  private final ExecStatus status;
  private final byte[] cmdStatus;
  private final byte[] cmdTuples;
  private final byte[] errorMessage;
  private final Map<DiagField, byte[]> errorFields;

  private FixedViewRawResult(Builder builder) {
    this.numFields = builder.numFields;
    this.rows = Collections.unmodifiableList(new ArrayList<>(builder.rows));
    this.status = builder.status;
    this.cmdStatus = copy(builder.cmdStatus);
    this.cmdTuples = copy(builder.cmdTuples);
    this.errorMessage = copy(builder.errorMessage);
    this.errorFields = new EnumMap<>(DiagField.class);
    for (Map.Entry<DiagField, byte[]> entry : builder.errorFields.entrySet()) {
      this.errorFields.put(entry.getKey(), copy(entry.getValue()));
    }
  }

  public static Builder builder(int numFields) {
    return new Builder(numFields);
  }

  @Override
  public int ntuples() {
    return rows.size();
  }

  @Override
  public int nfields() {
    return numFields;
  }

  @Override
  public byte[] getValue(int row, int column) {
    if (row < 0 || row >= rows.size()) {
      throw new IndexOutOfBoundsException("row " + row + " of " + rows.size());
    }
    if (column < 0 || column >= numFields) {
      throw new IndexOutOfBoundsException("column " + column + " of " + numFields);
    }
    return copy(rows.get(row)[column]);
  }

  @Override
  public ExecStatus resultStatus() {
    return status;
  }

  @Override
  public byte[] cmdStatus() {
    return copy(cmdStatus);
  }

  @Override
  public byte[] cmdTuples() {
    return copy(cmdTuples);
  }

  @Override
  public byte[] resultErrorMessage() {
    return copy(errorMessage);
  }

  @Override
  public byte[] resultErrorField(DiagField field) {
    return copy(errorFields.get(field));
  }

  private static byte[] copy(byte[] bytes) {
    return bytes == null ? null : bytes.clone();
  }

  private static byte[] utf8(String text) {
    return text == null ? null : text.getBytes(StandardCharsets.UTF_8);
  }

  /** Builder for {@link FixedViewRawResult}. Defaults to a successful SELECT. */
  public static final class Builder {
    private final int numFields;
    private final List<byte[][]> rows = new ArrayList<>();
    private ExecStatus status = ExecStatus.TUPLES_OK;
    private byte[] cmdStatus;
    private byte[] cmdTuples;
    private byte[] errorMessage;
    private final Map<DiagField, byte[]> errorFields = new EnumMap<>(DiagField.class);
    private boolean tagSet;

    private Builder(int numFields) {
      if (numFields < 0) {
        throw new IllegalArgumentException("numFields must not be negative: " + numFields);
      }
      this.numFields = numFields;
    }

    /**
     * Add a row of raw cells; null is SQL NULL.
     *
     * @param cells exactly numFields cells
     * @return this builder
     */
    public Builder addRow(byte[]... cells) {
      if (cells.length != numFields) {
        throw new IllegalArgumentException(
            "Row has " + cells.length + " cells, expected " + numFields);
      }
      byte[][] row = new byte[numFields][];
      for (int i = 0; i < numFields; i++) {
        row[i] = copy(cells[i]);
      }
      rows.add(row);
      return this;
    }

    /**
     * Add a row of text cells, encoded as UTF-8; null is SQL NULL.
     *
     * @param cells exactly numFields cells
     * @return this builder
     */
    public Builder addTextRow(String... cells) {
      byte[][] row = new byte[cells.length][];
      for (int i = 0; i < cells.length; i++) {
        row[i] = utf8(cells[i]);
      }
      return addRow(row);
    }

    public Builder status(ExecStatus status) {
      this.status = status;
      return this;
    }

    /**
     * Set the command tag and the affected row count. A null value means the driver has none.
     *
     * @param cmdStatus command tag
     * @param cmdTuples affected row count text
     * @return this builder
     */
    public Builder commandTag(String cmdStatus, String cmdTuples) {
      this.cmdStatus = utf8(cmdStatus);
      this.cmdTuples = utf8(cmdTuples);
      this.tagSet = true;
      return this;
    }

    public Builder rawCommandTag(byte[] cmdStatus, byte[] cmdTuples) {
      this.cmdStatus = copy(cmdStatus);
      this.cmdTuples = copy(cmdTuples);
      this.tagSet = true;
      return this;
    }

    /**
     * Mark the result as failed with the given SQL state and primary message.
     *
     * @param status error status, e.g. FATAL_ERROR
     * @param sqlState SQL state code
     * @param message error message
     * @return this builder
     */
    public Builder error(ExecStatus status, String sqlState, String message) {
      this.status = status;
      errorField(DiagField.SQLSTATE, sqlState);
      errorField(DiagField.MESSAGE_PRIMARY, message);
      this.errorMessage = utf8(message);
      return this;
    }

    public Builder errorField(DiagField field, String value) {
      if (value == null) {
        errorFields.remove(field);
      } else {
        errorFields.put(field, utf8(value));
      }
      return this;
    }

    public Builder errorMessage(String message) {
      this.errorMessage = utf8(message);
      return this;
    }

    public FixedViewRawResult build() {
      if (!tagSet) {
        // what the backend sends for a successful SELECT
        cmdStatus = utf8("SELECT " + rows.size());
        cmdTuples = utf8(String.valueOf(rows.size()));
      }
      return new FixedViewRawResult(this);
    }
  }
}
