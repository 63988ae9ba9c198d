package org.smae.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.smae.domain.ontology.MetabolicNetwork.CARBON;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.smae.domain.events.Event;
import org.smae.domain.source.Source;
import org.smae.domain.source.SourceTier;
import org.smae.testutil.EventFixtures;

class SourceVerifierTest {
  private final SourceVerifier verifier = new SourceVerifier();

  @Test
  void singleSourceIsProvisional() {
    Event event = EventFixtures.event("evt-1", CARBON)
        .source(EventFixtures.source("IDMC", SourceTier.UN_OPERATIONAL))
        .build();

    assertTrue(allProvisional(verify(event)));
  }

  @Test
  void twoSourcesSameTierAreProvisional() {
    Event event = EventFixtures.event("evt-1", CARBON)
        .source(EventFixtures.source("IDMC", SourceTier.UN_OPERATIONAL))
        .source(EventFixtures.source("OCHA", SourceTier.UN_OPERATIONAL))
        .build();

    assertTrue(allProvisional(verify(event)));
  }

  @Test
  void twoSourcesDistinctTiersWithoutActorsAreCorroborated() {
    Event event = EventFixtures.event("evt-1", CARBON)
        .source(EventFixtures.source("IDMC", SourceTier.UN_OPERATIONAL))
        .source(EventFixtures.source("EJAtlas", SourceTier.FRONTLINE_EJ))
        .build();

    Event verified = verify(event);

    assertSame(event, verified);
    assertFalse(verified.sources().stream().anyMatch(Source::provisional));
  }

  @Test
  void actorsNeedThreeSources() {
    Event event = EventFixtures.event("evt-1", CARBON)
        .actor(EventFixtures.actor("Mining Co"))
        .source(EventFixtures.source("IDMC", SourceTier.UN_OPERATIONAL))
        .source(EventFixtures.source("EJAtlas", SourceTier.FRONTLINE_EJ))
        .build();

    assertTrue(allProvisional(verify(event)));
  }

  @Test
  void actorsWithThreeDistinctTierSourcesAreCorroborated() {
    Event event = EventFixtures.event("evt-1", CARBON)
        .actor(EventFixtures.actor("Mining Co"))
        .source(EventFixtures.source("IDMC", SourceTier.UN_OPERATIONAL))
        .source(EventFixtures.source("EJAtlas", SourceTier.FRONTLINE_EJ))
        .source(EventFixtures.source("Global Witness", SourceTier.INVESTIGATIVE_MEDIA))
        .build();

    assertFalse(verifier.needsCorroboration(event));
  }

  @Test
  void neverUnmarksAndIsIdempotent() {
    Source alreadyProvisional = EventFixtures.source("IDMC", SourceTier.UN_OPERATIONAL).markProvisional();
    Event event = EventFixtures.event("evt-1", CARBON)
        .source(alreadyProvisional)
        .source(EventFixtures.source("EJAtlas", SourceTier.FRONTLINE_EJ))
        .build();

    Event once = verify(event);
    Event twice = verify(once);

    assertTrue(once.sources().get(0).provisional());
    assertEquals(once, twice);
  }

  @Test
  void zeroSourceEventsPassThrough() {
    Event event = EventFixtures.tagged("evt-1", CARBON);

    assertSame(event, verify(event));
  }

  private Event verify(Event event) {
    return verifier.verify(List.of(event)).get(0);
  }

  private static boolean allProvisional(Event event) {
    return !event.sources().isEmpty() && event.sources().stream().allMatch(Source::provisional);
  }
}
