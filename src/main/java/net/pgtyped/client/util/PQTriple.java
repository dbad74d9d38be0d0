package net.pgtyped.client.util;

import java.util.Objects;

/**
 * Immutable triple of values; any element may be null.
 *
 * @param <F> first type
 * @param <S> second type
 * @param <T> third type
 */
public final class PQTriple<F, S, T> {
  private final F first;
  private final S second;
  private final T third;

  private PQTriple(F first, S second, T third) {
    this.first = first;
    this.second = second;
    this.third = third;
  }

  public static <F, S, T> PQTriple<F, S, T> of(F first, S second, T third) {
    return new PQTriple<>(first, second, third);
  }

  public F first() {
    return first;
  }

  public S second() {
    return second;
  }

  public T third() {
    return third;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PQTriple<?, ?, ?> that = (PQTriple<?, ?, ?>) o;
    return Objects.equals(first, that.first)
        && Objects.equals(second, that.second)
        && Objects.equals(third, that.third);
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second, third);
  }

  @Override
  public String toString() {
    return "(" + first + ", " + second + ", " + third + ")";
  }
}
