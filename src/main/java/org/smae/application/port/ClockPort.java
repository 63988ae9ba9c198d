package org.smae.application.port;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the analytical pipeline.
 * <p><strong>Why:</strong> Run dates and lookback windows must be deterministic under test.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Calendar dates are derived in UTC.
 * @since 0.1.0
 * @see org.smae.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current time
   */
  Instant now();

  /**
   * Returns the current calendar date in UTC.
   *
   * @return today's date
   */
  default LocalDate today() {
    return LocalDate.ofInstant(now(), ZoneOffset.UTC);
  }

  /**
   * Default {@link ClockPort} using {@link Instant#now()}.
   */
  ClockPort SYSTEM = Instant::now;
}
