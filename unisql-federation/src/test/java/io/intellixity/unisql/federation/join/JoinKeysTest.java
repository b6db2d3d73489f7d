package io.intellixity.unisql.federation.join;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

final class JoinKeysTest {
  @Test
  void numbersRenderPlain() {
    assertEquals("1", JoinKeys.of(1));
    assertEquals("1", JoinKeys.of(1L));
    assertEquals("1", JoinKeys.of(1.0d));
    assertEquals("1", JoinKeys.of(new BigDecimal("1.00")));
    assertEquals("100", JoinKeys.of(new BigDecimal("1E+2")));
    assertEquals("0", JoinKeys.of(new BigDecimal("0.000")));
    assertEquals("2.5", JoinKeys.of(2.5f));
    assertEquals("nan", JoinKeys.of(Double.NaN));
  }

  @Test
  void decimalLookingText_isNotNormalised() {
    assertEquals("1.10", JoinKeys.of("1.10"));
    assertNotEquals(JoinKeys.of("1.10"), JoinKeys.of("1.1"));
    assertEquals("-4.0", JoinKeys.of("-4.0"));
    assertEquals("007", JoinKeys.of("007"));
    assertEquals(JoinKeys.of(new BigDecimal("1.10")), JoinKeys.of(1.1d));
  }

  @Test
  void textIsLowerCased_andNullIsEmpty() {
    assertEquals("mixed case", JoinKeys.of("Mixed CASE"));
    assertEquals("true", JoinKeys.of(Boolean.TRUE));
    assertEquals("", JoinKeys.of(null));
    assertEquals("0aff", JoinKeys.of(new byte[] {0x0a, (byte) 0xff}));
  }
}
