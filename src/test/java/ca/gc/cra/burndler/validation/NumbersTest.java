package ca.gc.cra.burndler.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("graceSeconds", 10, 0, 3_600));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("graceSeconds", -1, 0, 3_600));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("graceSeconds", 3_601, 0, 3_600));
  }

  @Test
  void parseIntTrimsAndChecksRange() {
    assertEquals(64, Numbers.parseInt("maxArtifactMiB", " 64 ", 1, 65_536));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInt("maxArtifactMiB", "0", 1, 65_536));
    assertEquals("maxArtifactMiB must be between 1 and 65536 (was 0)", ex.getMessage());
  }

  @Test
  void parseIntRejectsNonNumbers() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInt("graceSeconds", "ten", 0, 3_600));
    assertEquals("graceSeconds must be an integer (was 'ten')", ex.getMessage());
  }
}
