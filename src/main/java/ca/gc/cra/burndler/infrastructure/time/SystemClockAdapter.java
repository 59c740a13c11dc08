package ca.gc.cra.burndler.infrastructure.time;

import ca.gc.cra.burndler.application.port.ClockPort;
import java.time.Clock;
import java.util.Objects;

/**
 * {@link ClockPort} backed by a {@link java.time.Clock}, the system UTC clock unless one is supplied.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over an explicit clock, e.g. {@link Clock#fixed} for reproducible packages.
   *
   * @param clock time source
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long nowMillis() {
    return clock.millis();
  }
}
