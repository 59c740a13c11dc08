package ca.gc.cra.burndler.testing;

import ca.gc.cra.burndler.application.port.ClockPort;
import java.time.Instant;

/**
 * Clock returning a fixed instant.
 */
public final class FixedClock implements ClockPort {
  public static final Instant DEFAULT = Instant.parse("2024-05-01T12:30:45.678Z");

  private final long millis;

  public FixedClock() {
    this(DEFAULT);
  }

  public FixedClock(Instant instant) {
    this.millis = instant.toEpochMilli();
  }

  @Override
  public long nowMillis() {
    return millis;
  }
}
