package net.pgtyped.client.core.decode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import net.pgtyped.client.core.DecodeResult;
import org.junit.jupiter.api.Test;

public class TextColumnDecodersTest {

  @Test
  public void testNullDecodesToNull() {
    assertNull(TextColumnDecoders.text().decode(null).getValue());
    assertNull(TextColumnDecoders.int2().decode(null).getValue());
    assertNull(TextColumnDecoders.int4().decode(null).getValue());
    assertNull(TextColumnDecoders.int8().decode(null).getValue());
    assertNull(TextColumnDecoders.float8().decode(null).getValue());
    assertNull(TextColumnDecoders.numeric().decode(null).getValue());
    assertNull(TextColumnDecoders.bool().decode(null).getValue());
    assertNull(TextColumnDecoders.bytea().decode(null).getValue());
  }

  @Test
  public void testText() {
    assertEquals("zoë", TextColumnDecoders.text().decode(cell("zoë")).getValue());
    assertEquals("", TextColumnDecoders.text().decode(cell("")).getValue());
  }

  @Test
  public void testIntegers() {
    assertEquals((short) -12, TextColumnDecoders.int2().decode(cell("-12")).getValue());
    assertEquals(42, TextColumnDecoders.int4().decode(cell("42")).getValue());
    assertEquals(
        9223372036854775807L,
        TextColumnDecoders.int8().decode(cell("9223372036854775807")).getValue());
  }

  @Test
  public void testIntegerFailures() {
    DecodeResult<Integer> result = TextColumnDecoders.int4().decode(cell("abc"));
    assertFalse(result.isSuccess());
    assertEquals("invalid int4 value: \"abc\"", result.getErrorMessage());
    assertFalse(TextColumnDecoders.int2().decode(cell("40000")).isSuccess());
    assertFalse(TextColumnDecoders.int8().decode(cell("1.5")).isSuccess());
  }

  @Test
  public void testFloat8() {
    assertEquals(1.5, TextColumnDecoders.float8().decode(cell("1.5")).getValue());
    assertTrue(Double.isNaN(TextColumnDecoders.float8().decode(cell("NaN")).getValue()));
    assertEquals(
        Double.NEGATIVE_INFINITY,
        TextColumnDecoders.float8().decode(cell("-Infinity")).getValue());
    assertFalse(TextColumnDecoders.float8().decode(cell("one")).isSuccess());
  }

  @Test
  public void testNumeric() {
    assertEquals(
        new BigDecimal("12345678901234567890.0001"),
        TextColumnDecoders.numeric().decode(cell("12345678901234567890.0001")).getValue());
    assertFalse(TextColumnDecoders.numeric().decode(cell("1,5")).isSuccess());
  }

  @Test
  public void testBool() {
    assertEquals(Boolean.TRUE, TextColumnDecoders.bool().decode(cell("t")).getValue());
    assertEquals(Boolean.FALSE, TextColumnDecoders.bool().decode(cell("f")).getValue());
    assertEquals(
        "invalid bool value: \"true\"",
        TextColumnDecoders.bool().decode(cell("true")).getErrorMessage());
  }

  @Test
  public void testBytea() {
    assertArrayEquals(
        new byte[] {0x0a, (byte) 0xff},
        TextColumnDecoders.bytea().decode(cell("\\x0aff")).getValue());
    assertArrayEquals(new byte[0], TextColumnDecoders.bytea().decode(cell("\\x")).getValue());
    assertFalse(TextColumnDecoders.bytea().decode(cell("0aff")).isSuccess());
    assertFalse(TextColumnDecoders.bytea().decode(cell("\\x0")).isSuccess());
    assertFalse(TextColumnDecoders.bytea().decode(cell("\\xzz")).isSuccess());
  }

  @Test
  public void testNotNull() {
    ColumnDecoder<Integer> decoder = TextColumnDecoders.int4().notNull();
    assertEquals("unexpected NULL", decoder.decode(null).getErrorMessage());
    assertEquals(7, decoder.decode(cell("7")).getValue());
  }

  @Test
  public void testMap() {
    ColumnDecoder<String> upper = TextColumnDecoders.text().notNull().map(String::toUpperCase);
    assertEquals("ABC", upper.decode(cell("abc")).getValue());
    assertFalse(upper.decode(null).isSuccess());
  }

  private static byte[] cell(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
