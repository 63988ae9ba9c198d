package org.smae.application.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.smae.domain.events.Event;

/**
 * Flags events whose resistance record has not been collected yet.
 *
 * @since 0.1.0
 */
public final class ResistanceLinker {
  public static final String PENDING_RESISTANCE =
      "[PENDING] Resistance data not yet collected for this event. "
          + "Requires follow-up from frontline/EJ sources.";

  /**
   * Fills absent (null or empty) resistance summaries with {@link #PENDING_RESISTANCE}.
   *
   * @param events events to link
   * @return events with a resistance summary each; existing summaries are kept
   */
  public List<Event> link(List<Event> events) {
    Objects.requireNonNull(events, "events");
    List<Event> result = new ArrayList<>(events.size());
    for (Event event : events) {
      String summary = event.resistanceSummary();
      if (summary == null || summary.isEmpty()) {
        result.add(event.withResistanceSummary(PENDING_RESISTANCE));
      } else {
        result.add(event);
      }
    }
    return List.copyOf(result);
  }
}
