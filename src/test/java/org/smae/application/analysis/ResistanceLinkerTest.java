package org.smae.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.smae.domain.ontology.MetabolicNetwork.CARBON;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.smae.domain.events.Event;
import org.smae.testutil.EventFixtures;

class ResistanceLinkerTest {
  private final ResistanceLinker linker = new ResistanceLinker();

  @Test
  void absentSummaryBecomesPending() {
    Event event = EventFixtures.tagged("evt-1", CARBON);

    Event linked = linker.link(List.of(event)).get(0);

    assertEquals(
        "[PENDING] Resistance data not yet collected for this event. Requires follow-up from frontline/EJ sources.",
        linked.resistanceSummary());
    assertNull(event.resistanceSummary());
  }

  @Test
  void emptySummaryTreatedAsAbsent() {
    Event event = EventFixtures.event("evt-1", CARBON).resistanceSummary("").build();

    assertEquals(ResistanceLinker.PENDING_RESISTANCE, linker.link(List.of(event)).get(0).resistanceSummary());
  }

  @Test
  void existingSummaryUntouched() {
    Event event = EventFixtures.event("evt-1", CARBON).resistanceSummary("Road blockade since May").build();

    assertEquals("Road blockade since May", linker.link(List.of(event)).get(0).resistanceSummary());
  }
}
