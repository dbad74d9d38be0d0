package net.pgtyped.client.core;

import static net.pgtyped.client.util.PQUtil.decodeUtf8;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import net.pgtyped.client.jdbc.ColumnShapeMismatchException;
import net.pgtyped.client.jdbc.PgConnectionException;
import net.pgtyped.client.jdbc.PgSQLException;
import net.pgtyped.client.jdbc.RowDecodeException;
import net.pgtyped.client.jdbc.RowsOutOfBoundsException;
import net.pgtyped.client.log.PQLogger;
import net.pgtyped.client.log.PQLoggerFactory;
import net.pgtyped.client.util.PQPair;
import net.pgtyped.client.util.ThrowingFunction;

/**
 * Typed view over the raw result of an executed statement.
 *
 * <p>Pairs a {@link RowDecoder} with a {@link RawResult}. Neither is owned: the raw result belongs
 * to the driver, which must keep it alive until every operation on this object has returned.
 * Neither the decoder nor the raw result is written through, so one instance can be read from
 * several threads.
 *
 * <p>Every row access checks the result's column count against the decoder's width, so a decoder
 * built for a different statement fails with {@link ColumnShapeMismatchException} instead of
 * misreading cells.
 *
 * @param <T> row type
 */
public final class TypedResult<T> {
  private static final PQLogger logger = PQLoggerFactory.getLogger(TypedResult.class);

  static final String GET_ROW = "getRow";
  static final String NEXT_ROW = "nextRow";
  static final String GET_ROWS = "getRows";
  static final String FIRST_ROW = "firstRow";

  static final String CMD_STATUS_CALL = "cmdStatus";
  static final String CMD_TUPLES_CALL = "cmdTuples";

  private final RowDecoder<T> decoder;
  private final RawResult result;

  public TypedResult(RowDecoder<T> decoder, RawResult result) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.result = Objects.requireNonNull(result, "result");
  }

  public RowDecoder<T> getDecoder() {
    return decoder;
  }

  public RawResult getRawResult() {
    return result;
  }

  /**
   * Decode one row.
   *
   * @param index zero-based row number
   * @return the decoded row
   * @throws RowsOutOfBoundsException if index is negative or not below {@link #ntuples()}
   * @throws ColumnShapeMismatchException if the column count differs from the decoder's width
   * @throws RowDecodeException if the decoder rejects the row
   */
  public T getRow(int index) throws PgSQLException {
    int numRows = result.ntuples();
    if (index < 0 || index >= numRows) {
      throw new RowsOutOfBoundsException(GET_ROW, index, numRows);
    }
    return decodeRow(GET_ROW, index);
  }

  /**
   * Decode the row at {@code index} and return it with the index of the following row, or nothing
   * once {@code index >= total}. Meant for unfolding a result lazily: pass {@link #ntuples()} as
   * total and thread the returned index into the next call. There is no hidden cursor, so iteration
   * can restart from any index.
   *
   * @param total number of rows, normally {@link #ntuples()}
   * @param index zero-based row number
   * @return decoded row and next index, or empty past the end
   * @throws RowsOutOfBoundsException if index is negative, or below total but not below {@link
   *     #ntuples()} because total is stale
   * @throws ColumnShapeMismatchException if the column count differs from the decoder's width
   * @throws RowDecodeException if the decoder rejects the row
   */
  public Optional<PQPair<T, Integer>> nextRow(int total, int index) throws PgSQLException {
    if (index >= total) {
      return Optional.empty();
    }
    int numRows = result.ntuples();
    if (index < 0 || index >= numRows) {
      throw new RowsOutOfBoundsException(NEXT_ROW, index, numRows);
    }
    T row = decodeRow(NEXT_ROW, index);
    return Optional.of(PQPair.of(row, index + 1));
  }

  /**
   * Decode every row, in order. The first failing row aborts the whole call.
   *
   * @return decoded rows, one per row of the result
   * @throws ColumnShapeMismatchException if the column count differs from the decoder's width
   * @throws RowDecodeException if the decoder rejects any row
   */
  public List<T> getRows() throws PgSQLException {
    int numRows = result.ntuples();
    if (numRows <= 0) {
      return Collections.emptyList();
    }
    logger.trace("Decoding {} rows", numRows);
    List<T> rows = new ArrayList<>(numRows);
    for (int r = 0; r < numRows; r++) {
      rows.add(decodeRow(GET_ROWS, r));
    }
    return Collections.unmodifiableList(rows);
  }

  /**
   * Decode the first row if there is one. The returned holder is empty only when the result has no
   * rows; a row that decodes to null, e.g. the single NULL row of {@code SELECT max(x)} over an
   * empty table, is present with a null value.
   *
   * @return first row, or an empty holder if the result has no rows
   * @throws ColumnShapeMismatchException if the column count differs from the decoder's width
   * @throws RowDecodeException if the decoder rejects the row
   */
  public MaybeRow<T> firstRow() throws PgSQLException {
    if (result.ntuples() <= 0) {
      return MaybeRow.none();
    }
    return MaybeRow.of(decodeRow(FIRST_ROW, 0));
  }

  /** @return iterator over all rows, starting at row 0 */
  public RowIterator<T> iterator() {
    return rows(0);
  }

  /**
   * @param fromIndex first row to return
   * @return iterator over rows {@code fromIndex .. ntuples - 1}
   */
  public RowIterator<T> rows(int fromIndex) {
    return new RowIterator<>(this, ntuples(), fromIndex);
  }

  /**
   * Sequential stream of decoded rows. Decode failures are raised as {@link
   * ResultIterationException} while the stream is consumed.
   *
   * @return ordered stream of rows
   */
  public Stream<T> stream() {
    int total = ntuples();
    return StreamSupport.stream(
        Spliterators.spliterator(
            new RowIterator<>(this, total, 0),
            Math.max(total, 0),
            Spliterator.ORDERED | Spliterator.IMMUTABLE),
        false);
  }

  /**
   * View the same raw result through a decoder whose values are post-processed by {@code fn}.
   *
   * @param fn mapping applied to every decoded row
   * @param <R> new row type
   * @return typed result over the same raw result
   */
  public <R> TypedResult<R> map(Function<? super T, ? extends R> fn) {
    return new TypedResult<>(decoder.map(fn), result);
  }

  /**
   * Apply a function to the raw result. The other accessors are built on this.
   *
   * @param fn function reading the raw result
   * @param <X> value type
   * @param <E> failure type of the function
   * @return what the function returns
   * @throws E if the function fails
   */
  public <X, E extends Throwable> X liftResult(ThrowingFunction<RawResult, X, E> fn) throws E {
    return fn.apply(result);
  }

  /** @return number of rows */
  public int ntuples() {
    return liftResult(RawResult::ntuples);
  }

  /** @return number of columns */
  public int nfields() {
    return liftResult(RawResult::nfields);
  }

  public ExecStatus resultStatus() {
    return liftResult(RawResult::resultStatus);
  }

  /**
   * Command tag of the statement, commonly the command name optionally followed by a row count.
   *
   * @return command tag, empty if the backend sent an empty tag
   * @throws PgConnectionException if the driver has no tag at all
   */
  public String cmdStatus() throws PgSQLException {
    return liftResult(
        raw -> {
          byte[] bytes = raw.cmdStatus();
          if (bytes == null) {
            throw new PgConnectionException(CMD_STATUS_CALL);
          }
          return decodeUtf8(bytes);
        });
  }

  /**
   * Number of rows affected by the statement. Only SELECT, CREATE TABLE AS, INSERT, UPDATE,
   * DELETE, MERGE, MOVE, FETCH and COPY report one, as does EXECUTE of a prepared statement
   * containing one of them.
   *
   * @return affected rows, or empty if the command does not report a count or it is not a decimal
   *     integer fitting in a long; an optional minus sign is accepted, a plus sign is not
   * @throws PgConnectionException if the driver has no value at all
   */
  public Optional<Long> cmdTuples() throws PgSQLException {
    return liftResult(
        raw -> {
          byte[] bytes = raw.cmdTuples();
          if (bytes == null) {
            throw new PgConnectionException(CMD_TUPLES_CALL);
          }
          if (bytes.length == 0) {
            return Optional.<Long>empty();
          }
          return parseRowCount(bytes);
        });
  }

  /**
   * Check that the statement succeeded.
   *
   * @throws PgSQLException see {@link ResultErrorClassifier#okResult(RawResult)}
   */
  public void okResult() throws PgSQLException {
    ResultErrorClassifier.okResult(result);
  }

  public Optional<byte[]> resultErrorMessage() {
    return ResultErrorClassifier.resultErrorMessage(result);
  }

  public Optional<byte[]> resultErrorCode() {
    return ResultErrorClassifier.resultErrorCode(result);
  }

  public Optional<byte[]> resultErrorField(DiagField field) {
    return ResultErrorClassifier.resultErrorField(result, field);
  }

  private T decodeRow(String operation, int row) throws PgSQLException {
    int numCols = result.nfields();
    int width = decoder.expectedWidth();
    if (numCols != width) {
      throw new ColumnShapeMismatchException(operation, numCols, width);
    }

    byte[][] cells = new byte[numCols][];
    for (int c = 0; c < numCols; c++) {
      cells[c] = result.getValue(row, c);
    }

    DecodeResult<T> decoded = decoder.decode(Collections.unmodifiableList(Arrays.asList(cells)));
    if (!decoded.isSuccess()) {
      throw new RowDecodeException(operation, decoded.getErrorMessage());
    }
    return decoded.getValue();
  }

  private static Optional<Long> parseRowCount(byte[] bytes) {
    String text = new String(bytes, StandardCharsets.US_ASCII).trim();
    // the backend never sends an explicit plus sign
    if (text.startsWith("+")) {
      logger.debug("Ignoring non numeric affected row count: {}", text);
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(text));
    } catch (NumberFormatException ex) {
      logger.debug("Ignoring non numeric affected row count: {}", text);
      return Optional.empty();
    }
  }
}
