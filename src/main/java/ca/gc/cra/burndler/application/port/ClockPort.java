package ca.gc.cra.burndler.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to builds, packaging, and template functions.
 * <p><strong>Why:</strong> Archive timestamps, manifest creation times, and {@code now}/{@code timestamp} template
 * output become deterministic under test.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.burndler.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Returns {@link #nowMillis()} as an {@link Instant}. */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
