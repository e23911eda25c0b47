package org.eao.jsa.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("metricsPort", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesBelowMinimum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("metricsPort", 0, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesAboveMaximum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("metricsPort", 65, 1, 64));
  }

  @Test
  void clampKeepsHumidityWithinPercentRange() {
    assertEquals(100.0, Numbers.clamp(104.2, 0.0, 100.0));
    assertEquals(0.0, Numbers.clamp(-3.0, 0.0, 100.0));
    assertEquals(55.5, Numbers.clamp(55.5, 0.0, 100.0));
  }

  @Test
  void clampPassesNaNThrough() {
    assertTrue(Double.isNaN(Numbers.clamp(Double.NaN, 0.0, 90.0)));
  }

  @Test
  void nearUsesStrictTolerance() {
    assertTrue(Numbers.near(1.0, 1.0 + 1e-9, 1e-6));
    assertFalse(Numbers.near(1.0, 1.1, 0.1));
  }
}
