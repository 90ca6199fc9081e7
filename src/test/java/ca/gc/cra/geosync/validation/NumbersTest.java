package ca.gc.cra.geosync.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeIsInclusive() {
    assertEquals(1, Numbers.requireRange("commitAttempts", 1, 1, 10));
    assertEquals(10, Numbers.requireRange("commitAttempts", 10, 1, 10));
  }

  @Test
  void outOfRangeNamesTheParameter() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("commitAttempts", 0, 1, 10));
    assertEquals("commitAttempts must be between 1 and 10 (was 0)", ex.getMessage());
    ex = assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange(" ", 11, 1, 10));
    assertEquals("value must be between 1 and 10 (was 11)", ex.getMessage());
  }
}
