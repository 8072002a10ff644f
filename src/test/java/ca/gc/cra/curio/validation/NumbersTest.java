package ca.gc.cra.curio.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {
  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(0L, Numbers.requireRange("delay", 0, 0, 10));
    assertEquals(10L, Numbers.requireRange("delay", 10, 0, 10));
  }

  @Test
  void requireRangeRejectsOutside() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("delay", 11, 0, 10));
    assertEquals("delay must be between 0 and 10 (was 11)", ex.getMessage());
  }

  @Test
  void parseLongReportsName() {
    assertEquals(42L, Numbers.parseLong("delay", " 42 "));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("delay", "x"));
    assertTrue(ex.getMessage().startsWith("delay must be a number"));
  }
}
