package org.smae.domain.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class SourceTest {
  private static final LocalDate ACCESSED = LocalDate.of(2025, 3, 1);

  @Test
  void citationPrefersDoiOverReportId() {
    Source source = new Source("IDMC", "GRID 2025", "10.1234/grid", "R-7", SourceTier.UN_OPERATIONAL, ACCESSED, false);

    assertEquals("IDMC — GRID 2025 — 10.1234/grid", source.citation());
  }

  @Test
  void citationFallsBackToReportId() {
    Source source = new Source("IDMC", "GRID 2025", null, "R-7", SourceTier.UN_OPERATIONAL, ACCESSED, false);

    assertEquals("IDMC — GRID 2025 — R-7", source.citation());
  }

  @Test
  void markProvisionalIsIdempotent() {
    Source source = Source.of("ACLED", "Weekly", SourceTier.SPECIALIZED_RESEARCH, ACCESSED);
    Source provisional = source.markProvisional();

    assertFalse(source.provisional());
    assertTrue(provisional.provisional());
    assertSame(provisional, provisional.markProvisional());
  }

  @Test
  void tiersRankFrontlineHighest() {
    assertEquals(1, SourceTier.FRONTLINE_EJ.rank());
    assertEquals(7, SourceTier.GOVERNMENT_REGULATORY.rank());
    assertTrue(SourceTier.FRONTLINE_EJ.isAtLeast(SourceTier.UN_OPERATIONAL));
    assertFalse(SourceTier.GOVERNMENT_REGULATORY.isAtLeast(SourceTier.UN_OPERATIONAL));
  }
}
