package net.pgtyped.client.core.decode;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import net.pgtyped.client.core.DecodeResult;

/**
 * Column decoders for values in the backend's text output format. Each maps SQL NULL to null;
 * combine with {@link ColumnDecoder#notNull()} for NOT NULL columns.
 */
public class TextColumnDecoders {
  private TextColumnDecoders() {}

  public static ColumnDecoder<String> text() {
    return cell -> DecodeResult.success(cell == null ? null : utf8(cell));
  }

  public static ColumnDecoder<Short> int2() {
    return cell -> {
      if (cell == null) {
        return DecodeResult.success(null);
      }
      String text = utf8(cell);
      try {
        return DecodeResult.success(Short.parseShort(text));
      } catch (NumberFormatException ex) {
        return DecodeResult.failure("invalid int2 value: \"" + text + "\"");
      }
    };
  }

  public static ColumnDecoder<Integer> int4() {
    return cell -> {
      if (cell == null) {
        return DecodeResult.success(null);
      }
      String text = utf8(cell);
      try {
        return DecodeResult.success(Integer.parseInt(text));
      } catch (NumberFormatException ex) {
        return DecodeResult.failure("invalid int4 value: \"" + text + "\"");
      }
    };
  }

  public static ColumnDecoder<Long> int8() {
    return cell -> {
      if (cell == null) {
        return DecodeResult.success(null);
      }
      String text = utf8(cell);
      try {
        return DecodeResult.success(Long.parseLong(text));
      } catch (NumberFormatException ex) {
        return DecodeResult.failure("invalid int8 value: \"" + text + "\"");
      }
    };
  }

  public static ColumnDecoder<Double> float8() {
    return cell -> {
      if (cell == null) {
        return DecodeResult.success(null);
      }
      String text = utf8(cell);
      switch (text) {
        case "NaN":
          return DecodeResult.success(Double.NaN);
        case "Infinity":
          return DecodeResult.success(Double.POSITIVE_INFINITY);
        case "-Infinity":
          return DecodeResult.success(Double.NEGATIVE_INFINITY);
        default:
          try {
            return DecodeResult.success(Double.parseDouble(text));
          } catch (NumberFormatException ex) {
            return DecodeResult.failure("invalid float8 value: \"" + text + "\"");
          }
      }
    };
  }

  public static ColumnDecoder<BigDecimal> numeric() {
    return cell -> {
      if (cell == null) {
        return DecodeResult.success(null);
      }
      String text = utf8(cell);
      try {
        return DecodeResult.success(new BigDecimal(text));
      } catch (NumberFormatException ex) {
        return DecodeResult.failure("invalid numeric value: \"" + text + "\"");
      }
    };
  }

  /** Boolean in text format: {@code t} or {@code f}. */
  public static ColumnDecoder<Boolean> bool() {
    return cell -> {
      if (cell == null) {
        return DecodeResult.success(null);
      }
      String text = utf8(cell);
      if ("t".equals(text)) {
        return DecodeResult.success(Boolean.TRUE);
      }
      if ("f".equals(text)) {
        return DecodeResult.success(Boolean.FALSE);
      }
      return DecodeResult.failure("invalid bool value: \"" + text + "\"");
    };
  }

  /** bytea in hex format, e.g. {@code \x0aff}. */
  public static ColumnDecoder<byte[]> bytea() {
    return cell -> {
      if (cell == null) {
        return DecodeResult.success(null);
      }
      String text = utf8(cell);
      if (!text.startsWith("\\x") || text.length() % 2 != 0) {
        return DecodeResult.failure("bytea value is not in hex format");
      }
      byte[] bytes = new byte[(text.length() - 2) / 2];
      for (int i = 0; i < bytes.length; i++) {
        int high = Character.digit(text.charAt(2 + 2 * i), 16);
        int low = Character.digit(text.charAt(3 + 2 * i), 16);
        if (high < 0 || low < 0) {
          return DecodeResult.failure("invalid hex digit in bytea value at byte " + i);
        }
        bytes[i] = (byte) ((high << 4) | low);
      }
      return DecodeResult.success(bytes);
    };
  }

  private static String utf8(byte[] cell) {
    return new String(cell, StandardCharsets.UTF_8);
  }
}
