package org.smae.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class SystemClockAdapterTest {

  @Test
  void todayIsDerivedInUtc() {
    Instant lateEvening = Instant.parse("2025-03-15T23:30:00Z");
    SystemClockAdapter clock = new SystemClockAdapter(Clock.fixed(lateEvening, ZoneId.of("Pacific/Auckland")));

    assertEquals(lateEvening, clock.now());
    assertEquals(LocalDate.of(2025, 3, 15), clock.today());
  }
}
