package net.pgtyped.client.util;

import java.util.Objects;

/**
 * Immutable pair of values; either side may be null.
 *
 * @param <L> left type
 * @param <R> right type
 */
public final class PQPair<L, R> {
  private final L left;
  private final R right;

  private PQPair(L left, R right) {
    this.left = left;
    this.right = right;
  }

  public static <L, R> PQPair<L, R> of(L left, R right) {
    return new PQPair<>(left, right);
  }

  public L left() {
    return left;
  }

  public R right() {
    return right;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PQPair<?, ?> that = (PQPair<?, ?>) o;
    return Objects.equals(left, that.left) && Objects.equals(right, that.right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(left, right);
  }

  @Override
  public String toString() {
    return "(" + left + ", " + right + ")";
  }
}
