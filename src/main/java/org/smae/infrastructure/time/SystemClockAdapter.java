package org.smae.infrastructure.time;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import org.smae.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by a {@link Clock}, the system UTC clock by default.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /**
   * Creates a clock adapter over {@link Clock#systemUTC()}.
   */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates a clock adapter over the supplied clock, e.g. {@link Clock#fixed} in tests.
   *
   * @param clock backing clock
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Instant now() {
    return clock.instant();
  }
}
