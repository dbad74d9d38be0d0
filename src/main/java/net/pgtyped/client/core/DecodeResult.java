package net.pgtyped.client.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of decoding one row: a value, or a message saying which constraint the cells violated.
 * Malformed data is an expected condition, so decoders return it instead of throwing.
 *
 * @param <T> decoded type
 */
public final class DecodeResult<T> {
  private final T value;
  private final String errorMessage;

  private DecodeResult(T value, String errorMessage) {
    this.value = value;
    this.errorMessage = errorMessage;
  }

  /**
   * @param value decoded value, may be null when the decoder maps SQL NULL to null
   */
  public static <T> DecodeResult<T> success(T value) {
    return new DecodeResult<>(value, null);
  }

  public static <T> DecodeResult<T> failure(String errorMessage) {
    return new DecodeResult<>(null, Objects.requireNonNull(errorMessage, "errorMessage"));
  }

  public boolean isSuccess() {
    return errorMessage == null;
  }

  /**
   * @return the decoded value
   * @throws IllegalStateException if this is a failure
   */
  public T getValue() {
    if (!isSuccess()) {
      throw new IllegalStateException("No value, decode failed: " + errorMessage);
    }
    return value;
  }

  /**
   * @return the failure message
   * @throws IllegalStateException if this is a success
   */
  public String getErrorMessage() {
    if (isSuccess()) {
      throw new IllegalStateException("Decode succeeded, there is no error message");
    }
    return errorMessage;
  }

  public <R> DecodeResult<R> map(Function<? super T, ? extends R> fn) {
    if (!isSuccess()) {
      return failure(errorMessage);
    }
    return success(fn.apply(value));
  }

  public <R> DecodeResult<R> flatMap(Function<? super T, DecodeResult<R>> fn) {
    if (!isSuccess()) {
      return failure(errorMessage);
    }
    return fn.apply(value);
  }

  /**
   * Prefix the failure message with context, e.g. the column it came from.
   *
   * @param context text placed before the message
   * @return this if successful, otherwise a failure with the prefixed message
   */
  public DecodeResult<T> withContext(String context) {
    if (isSuccess()) {
      return this;
    }
    return failure(context + ": " + errorMessage);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DecodeResult<?> that = (DecodeResult<?>) o;
    return Objects.equals(value, that.value) && Objects.equals(errorMessage, that.errorMessage);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, errorMessage);
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success{" + value + "}" : "Failure{" + errorMessage + "}";
  }
}
