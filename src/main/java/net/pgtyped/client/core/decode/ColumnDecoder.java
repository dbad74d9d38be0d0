package net.pgtyped.client.core.decode;

import java.util.function.Function;
import net.pgtyped.client.core.DecodeResult;

/**
 * Decodes one cell. Receives null for SQL NULL; {@link #notNull()} turns NULL into a failure.
 *
 * @param <T> cell type
 */
@FunctionalInterface
public interface ColumnDecoder<T> {
  DecodeResult<T> decode(byte[] cell);

  /** @return decoder that rejects SQL NULL and otherwise delegates to this one */
  default ColumnDecoder<T> notNull() {
    ColumnDecoder<T> self = this;
    return cell -> cell == null ? DecodeResult.failure("unexpected NULL") : self.decode(cell);
  }

  default <R> ColumnDecoder<R> map(Function<? super T, ? extends R> fn) {
    ColumnDecoder<T> self = this;
    return cell -> self.decode(cell).map(fn);
  }
}
