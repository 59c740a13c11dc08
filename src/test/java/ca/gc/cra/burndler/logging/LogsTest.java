package ca.gc.cra.burndler.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 10));
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void truncateNotesOriginalSize() {
    assertEquals("abc... (truncated, 6 bytes)", Logs.truncate("abcdef", 3));
  }

  @Test
  void truncateRejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void redactHidesCredentialLikeKeys() {
    assertEquals("[REDACTED]", Logs.redact("DB_PASSWORD", "hunter2"));
    assertEquals("[REDACTED]", Logs.redact("apiToken", "abc"));
    assertEquals("8080", Logs.redact("port", "8080"));
  }

  @Test
  void redactMapSortsKeys() {
    Map<String, String> redacted = Logs.redact(Map.of("target", "shop", "secretKey", "s3cr3t"));
    assertEquals(List.of("secretKey", "target"), List.copyOf(redacted.keySet()));
    assertEquals("[REDACTED]", redacted.get("secretKey"));
    assertEquals("shop", redacted.get("target"));
  }
}
