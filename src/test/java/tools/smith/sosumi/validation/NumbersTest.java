package tools.smith.sosumi.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parsesWithinRange() {
    assertEquals(2024, Numbers.parseInt("year", " 2024 ", 2007, 2030));
  }

  @Test
  void rejectsNonNumbersAndOutOfRange() {
    IllegalArgumentException notNumber =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("year", "twenty", 2007, 2030));
    IllegalArgumentException tooLow =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("year", "1999", 2007, 2030));

    assertTrue(notNumber.getMessage().startsWith("year must be an integer"));
    assertTrue(tooLow.getMessage().contains("between 2007 and 2030"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("year", null, 2007, 2030));
  }

  @Test
  void requireRangeReturnsValue() {
    assertEquals(5L, Numbers.requireRange("limit", 5, 1, 10));
  }
}
