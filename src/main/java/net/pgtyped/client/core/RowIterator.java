package net.pgtyped.client.core;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import net.pgtyped.client.jdbc.PgSQLException;
import net.pgtyped.client.util.PQPair;

/**
 * Finite iterator over the rows of a {@link TypedResult}, driven by {@link
 * TypedResult#nextRow(int, int)}. The row count is captured when the iterator is created.
 *
 * <p>{@link Iterator#next()} cannot throw checked exceptions, so decode failures are wrapped in
 * {@link ResultIterationException}.
 *
 * @param <T> row type
 */
public class RowIterator<T> implements Iterator<T> {
  private final TypedResult<T> result;
  private final int total;
  private int index;

  RowIterator(TypedResult<T> result, int total, int fromIndex) {
    if (fromIndex < 0) {
      throw new IllegalArgumentException("fromIndex must not be negative: " + fromIndex);
    }
    this.result = result;
    this.total = total;
    this.index = fromIndex;
  }

  @Override
  public boolean hasNext() {
    return index < total;
  }

  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No row " + index + ", result has " + total + " rows");
    }
    Optional<PQPair<T, Integer>> next;
    try {
      next = result.nextRow(total, index);
    } catch (PgSQLException ex) {
      throw new ResultIterationException(ex);
    }
    PQPair<T, Integer> pair = next.orElseThrow(NoSuchElementException::new);
    index = pair.right();
    return pair.left();
  }

  /** @return index of the row the next call to {@link #next()} decodes */
  public int nextIndex() {
    return index;
  }

  public int getTotal() {
    return total;
  }
}
