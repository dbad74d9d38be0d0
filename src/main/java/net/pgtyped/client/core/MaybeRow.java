package net.pgtyped.client.core;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A row that may be missing. Unlike {@link Optional} a present row may hold null, which is what a
 * decoder returns for a row of SQL NULLs, so "no row" and "a null row" stay distinguishable.
 *
 * @param <T> row type
 */
public final class MaybeRow<T> {
  private static final MaybeRow<?> NONE = new MaybeRow<>(false, null);

  private final boolean present;
  private final T row;

  private MaybeRow(boolean present, T row) {
    this.present = present;
    this.row = row;
  }

  @SuppressWarnings("unchecked")
  public static <T> MaybeRow<T> none() {
    return (MaybeRow<T>) NONE;
  }

  /**
   * @param row decoded row, may be null
   * @return a present holder
   */
  public static <T> MaybeRow<T> of(T row) {
    return new MaybeRow<>(true, row);
  }

  public boolean isPresent() {
    return present;
  }

  /**
   * @return the row, possibly null
   * @throws NoSuchElementException if there is no row
   */
  public T get() {
    if (!present) {
      throw new NoSuchElementException("Result has no rows");
    }
    return row;
  }

  public T orElse(T other) {
    return present ? row : other;
  }

  public <R> MaybeRow<R> map(Function<? super T, ? extends R> fn) {
    return present ? of(fn.apply(row)) : none();
  }

  /**
   * @return the row as an {@link Optional}; a present null row becomes empty
   */
  public Optional<T> toOptional() {
    return present ? Optional.ofNullable(row) : Optional.empty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MaybeRow<?> that = (MaybeRow<?>) o;
    return present == that.present && Objects.equals(row, that.row);
  }

  @Override
  public int hashCode() {
    return Objects.hash(present, row);
  }

  @Override
  public String toString() {
    return present ? "MaybeRow[" + row + "]" : "MaybeRow.none";
  }
}
