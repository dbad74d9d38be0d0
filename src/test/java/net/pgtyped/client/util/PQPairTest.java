package net.pgtyped.client.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

public class PQPairTest {

  @Test
  public void testPairEquality() {
    assertEquals(PQPair.of("a", 1), PQPair.of("a", 1));
    assertEquals(PQPair.of("a", 1).hashCode(), PQPair.of("a", 1).hashCode());
    assertEquals(PQPair.of(null, null), PQPair.of(null, null));
    assertNotEquals(PQPair.of("a", 1), PQPair.of("a", 2));
    assertNotEquals(PQPair.of("a", 1), null);
    assertEquals("(a, null)", PQPair.of("a", null).toString());
  }

  @Test
  public void testTripleEquality() {
    PQTriple<String, Integer, Boolean> triple = PQTriple.of("a", 1, true);
    assertEquals(PQTriple.of("a", 1, true), triple);
    assertEquals(PQTriple.of("a", 1, true).hashCode(), triple.hashCode());
    assertNotEquals(PQTriple.of("a", 1, false), triple);
    assertEquals("a", triple.first());
    assertEquals(1, triple.second());
    assertEquals(Boolean.TRUE, triple.third());
  }
}
