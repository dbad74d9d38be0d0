package net.pgtyped.client.core.decode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.pgtyped.client.core.DecodeResult;
import net.pgtyped.client.core.RowDecoder;
import net.pgtyped.client.util.PQPair;
import net.pgtyped.client.util.PQTriple;

/** Builds fixed-width row decoders out of column decoders. */
public class RowDecoders {
  private RowDecoders() {}

  public static <A> RowDecoder<A> single(ColumnDecoder<A> first) {
    return new FixedWidthRowDecoder<A>(1) {
      @Override
      DecodeResult<A> decodeCells(List<byte[]> cells) {
        return column(first, cells, 0);
      }
    };
  }

  public static <A, B> RowDecoder<PQPair<A, B>> pair(
      ColumnDecoder<A> first, ColumnDecoder<B> second) {
    return new FixedWidthRowDecoder<PQPair<A, B>>(2) {
      @Override
      DecodeResult<PQPair<A, B>> decodeCells(List<byte[]> cells) {
        return column(first, cells, 0)
            .flatMap(a -> column(second, cells, 1).map(b -> PQPair.of(a, b)));
      }
    };
  }

  public static <A, B, C> RowDecoder<PQTriple<A, B, C>> triple(
      ColumnDecoder<A> first, ColumnDecoder<B> second, ColumnDecoder<C> third) {
    return new FixedWidthRowDecoder<PQTriple<A, B, C>>(3) {
      @Override
      DecodeResult<PQTriple<A, B, C>> decodeCells(List<byte[]> cells) {
        return column(first, cells, 0)
            .flatMap(
                a ->
                    column(second, cells, 1)
                        .flatMap(
                            b ->
                                column(third, cells, 2)
                                    .map(c -> PQTriple.<A, B, C>of(a, b, c))));
      }
    };
  }

  /**
   * Decoder for rows whose columns all share one type, e.g. a row of text values.
   *
   * @param width number of columns
   * @param decoder decoder applied to every column
   * @return decoder producing an unmodifiable list per row
   */
  public static <A> RowDecoder<List<A>> uniform(int width, ColumnDecoder<A> decoder) {
    if (width < 0) {
      throw new IllegalArgumentException("width must not be negative: " + width);
    }
    return new FixedWidthRowDecoder<List<A>>(width) {
      @Override
      DecodeResult<List<A>> decodeCells(List<byte[]> cells) {
        List<A> values = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
          DecodeResult<A> value = column(decoder, cells, i);
          if (!value.isSuccess()) {
            return DecodeResult.failure(value.getErrorMessage());
          }
          values.add(value.getValue());
        }
        return DecodeResult.success(Collections.unmodifiableList(values));
      }
    };
  }

  private static <A> DecodeResult<A> column(ColumnDecoder<A> decoder, List<byte[]> cells, int i) {
    return decoder.decode(cells.get(i)).withContext("column " + i);
  }

  private abstract static class FixedWidthRowDecoder<T> implements RowDecoder<T> {
    private final int width;

    FixedWidthRowDecoder(int width) {
      this.width = width;
    }

    @Override
    public int expectedWidth() {
      return width;
    }

    @Override
    public DecodeResult<T> decode(List<byte[]> cells) {
      if (cells.size() != width) {
        return DecodeResult.failure(
            "expected " + width + " columns, got " + cells.size());
      }
      return decodeCells(cells);
    }

    abstract DecodeResult<T> decodeCells(List<byte[]> cells);
  }
}
