package net.pgtyped.client.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class DecodeResultTest {

  @Test
  public void testSuccess() {
    DecodeResult<Integer> result = DecodeResult.success(5);
    assertTrue(result.isSuccess());
    assertEquals(5, result.getValue());
    assertThrows(IllegalStateException.class, result::getErrorMessage);
    assertEquals("Success{5}", result.toString());
  }

  @Test
  public void testSuccessWithNull() {
    DecodeResult<String> result = DecodeResult.success(null);
    assertTrue(result.isSuccess());
    assertNull(result.getValue());
  }

  @Test
  public void testFailure() {
    DecodeResult<Integer> result = DecodeResult.failure("bad");
    assertFalse(result.isSuccess());
    assertEquals("bad", result.getErrorMessage());
    assertThrows(IllegalStateException.class, result::getValue);
    assertThrows(NullPointerException.class, () -> DecodeResult.failure(null));
  }

  @Test
  public void testMapAndFlatMap() {
    DecodeResult<Integer> six = DecodeResult.success(6);
    DecodeResult<Integer> bad = DecodeResult.failure("bad");
    assertEquals(DecodeResult.success("6"), six.map(i -> Integer.toString(i)));
    assertEquals(DecodeResult.failure("bad"), bad.map(i -> Integer.toString(i)));
    assertEquals(
        DecodeResult.failure("odd"),
        DecodeResult.success(3)
            .<Integer>flatMap(
                i -> i % 2 == 0 ? DecodeResult.success(i) : DecodeResult.failure("odd")));
    assertEquals(bad, bad.flatMap(i -> DecodeResult.success(i + 1)));
  }

  @Test
  public void testWithContext() {
    DecodeResult<Integer> success = DecodeResult.success(1);
    assertSame(success, success.withContext("column 0"));
    assertEquals(
        "column 1: bad", DecodeResult.failure("bad").withContext("column 1").getErrorMessage());
  }

  @Test
  public void testEquality() {
    assertEquals(DecodeResult.success(1), DecodeResult.success(1));
    assertEquals(DecodeResult.success(1).hashCode(), DecodeResult.success(1).hashCode());
    assertNotEquals(DecodeResult.success(1), DecodeResult.success(2));
    assertNotEquals(DecodeResult.success(null), DecodeResult.failure("x"));
  }
}
