package net.pgtyped.client.core;

import java.util.List;
import java.util.function.Function;

/**
 * Pure function from one row of raw cells to a typed value. The width it expects is fixed when the
 * decoder is built and is checked against every row before {@link #decode(List)} is called.
 *
 * @param <T> decoded row type
 */
public interface RowDecoder<T> {
  /** @return number of cells this decoder consumes */
  int expectedWidth();

  /**
   * @param cells exactly {@link #expectedWidth()} cells; a null element is SQL NULL
   * @return the decoded value or the reason the cells were rejected
   */
  DecodeResult<T> decode(List<byte[]> cells);

  /**
   * Post-process successfully decoded values. The width is unchanged.
   *
   * @param fn mapping applied to each decoded value
   * @param <R> new row type
   * @return decoder producing mapped values
   */
  default <R> RowDecoder<R> map(Function<? super T, ? extends R> fn) {
    RowDecoder<T> self = this;
    return new RowDecoder<R>() {
      @Override
      public int expectedWidth() {
        return self.expectedWidth();
      }

      @Override
      public DecodeResult<R> decode(List<byte[]> cells) {
        return self.decode(cells).map(fn);
      }
    };
  }
}
