package org.smae.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1, Numbers.requireRange("lookbackDays", 1, 1, 365));
    assertEquals(365, Numbers.requireRange("lookbackDays", 365, 1, 365));
  }

  @Test
  void requireRangeRejectsOutside() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("lookbackDays", 0, 1, 365));
    assertTrue(ex.getMessage().startsWith("lookbackDays must be between 1 and 365"));
  }

  @Test
  void requireFiniteRejectsNanAndInfinity() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireFinite("current", Double.NaN));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireFinite("current", Double.POSITIVE_INFINITY));
  }
}
