package ca.gc.cra.recstream.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("maxHostFunctions", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("maxHostFunctions", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("maxHostFunctions", 65, 1, 64));
  }

  @Test
  void parseIntInRangeParsesTrimmedText() {
    assertEquals(42, Numbers.parseIntInRange("n", " 42 ", 1, 100));
  }

  @Test
  void parseIntInRangeRejectsNonNumbers() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("n", "forty", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("n", "99999999999", 1, 100));
  }
}
