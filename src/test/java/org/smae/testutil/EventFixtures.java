package org.smae.testutil;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.smae.domain.events.Actor;
import org.smae.domain.events.AlertLevel;
import org.smae.domain.events.Event;
import org.smae.domain.ontology.AnalyticalLayer;
import org.smae.domain.ontology.MetabolicNetwork;
import org.smae.domain.ontology.OntologyNode;
import org.smae.domain.source.Source;
import org.smae.domain.source.SourceTier;
import org.smae.domain.threshold.ThresholdCategory;
import org.smae.domain.threshold.ThresholdCrossing;
import org.smae.domain.threshold.ThresholdMetric;
import org.smae.domain.threshold.ThresholdStatus;

/**
 * Builders for events, crossings and sources used across pipeline tests.
 */
public final class EventFixtures {
  public static final LocalDate EVENT_DATE = LocalDate.of(2025, 3, 14);
  public static final Instant DETECTED_AT = Instant.parse("2025-03-14T06:00:00Z");

  private EventFixtures() {}

  /**
   * Starts a tagged event (one layer, one node) over the given networks.
   */
  public static Event.Builder event(String id, MetabolicNetwork... networks) {
    return Event.builder(id)
        .title("Event " + id)
        .summary("Summary of " + id)
        .eventDate(EVENT_DATE)
        .detectedAt(DETECTED_AT)
        .country("BR")
        .networks(List.of(networks))
        .layer(AnalyticalLayer.FLOW)
        .node(OntologyNode.DISPLACEMENT);
  }

  public static Event tagged(String id, MetabolicNetwork... networks) {
    return event(id, networks).build();
  }

  /**
   * Creates a crossing with the given live reading and bound, carrying a deliberately stale BELOW status.
   */
  public static ThresholdCrossing crossing(double current, double threshold) {
    return crossing(current, threshold, ThresholdStatus.BELOW);
  }

  public static ThresholdCrossing crossing(double current, double threshold, ThresholdStatus status) {
    ThresholdMetric metric = new ThresholdMetric(
        "displacement_single_event",
        ThresholdCategory.ABSOLUTE,
        List.of(MetabolicNetwork.CARBON),
        current / 2,
        LocalDate.of(2024, 1, 1),
        current / 2,
        current,
        threshold,
        "persons",
        status);
    return new ThresholdCrossing(metric, DETECTED_AT, AlertLevel.WATCH, "");
  }

  public static Source source(String organization, SourceTier tier) {
    return Source.of(organization, organization + " report", tier, EVENT_DATE);
  }

  public static Actor actor(String name) {
    return new Actor(name, "corporation", null, "extractor");
  }
}
