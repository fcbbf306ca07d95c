package ca.gc.cra.fitsio.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValue() {
    assertEquals(5, Numbers.requireRange("hdu", 5, 1, 10));
  }

  @Test
  void requireRangeNamesValueInMessage() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("column index", 4, 0, 3));
    assertEquals("column index must be between 0 and 3 (was 4)", ex.getMessage());
  }

  @Test
  void requireNonNegativeRejectsNegative() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireNonNegative("rows", -1));
  }

  @Test
  void requireArrayLengthRejectsOversizedBuffers() {
    assertEquals(1024, Numbers.requireArrayLength("pixels", 1024));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireArrayLength("pixels", Integer.MAX_VALUE));
  }
}
