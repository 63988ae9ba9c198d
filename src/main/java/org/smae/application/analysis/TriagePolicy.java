package org.smae.application.analysis;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.smae.domain.convergence.ConvergenceScore;
import org.smae.domain.events.AlertLevel;
import org.smae.domain.events.Event;
import org.smae.domain.threshold.ThresholdStatus;

/**
 * Assigns alert levels from threshold status and convergence score.
 * <p>Rules, first match wins:</p>
 * <ol>
 *   <li>score &ge; 4 and an exceeded threshold: {@link AlertLevel#SYSTEMIC}</li>
 *   <li>score &ge; 3 and an exceeded threshold: {@link AlertLevel#CRITICAL}</li>
 *   <li>an exceeded threshold: {@link AlertLevel#ALERT}</li>
 *   <li>an approaching threshold or score &ge; 2: {@link AlertLevel#MONITOR}</li>
 *   <li>otherwise {@link AlertLevel#WATCH}</li>
 * </ol>
 * Events without a score are treated as having no convergence signal.
 *
 * @since 0.1.0
 */
public final class TriagePolicy {

  public List<Event> triage(List<Event> events, List<ConvergenceScore> scores) {
    Objects.requireNonNull(events, "events");
    Objects.requireNonNull(scores, "scores");
    Map<String, ConvergenceScore> byEvent = new HashMap<>();
    for (ConvergenceScore score : scores) {
      byEvent.put(score.eventId(), score);
    }
    List<Event> result = new ArrayList<>(events.size());
    for (Event event : events) {
      result.add(event.withAlertLevel(levelFor(event, byEvent.get(event.id()))));
    }
    return List.copyOf(result);
  }

  /**
   * Computes the alert level for a single event.
   *
   * @param event event under triage
   * @param score its convergence score; {@code null} when none was computed
   * @return alert level
   */
  public AlertLevel levelFor(Event event, ConvergenceScore score) {
    double ci = score == null ? 0.0 : score.ciScore();
    boolean exceeded = event.hasCrossingWithStatus(ThresholdStatus.EXCEEDED);
    boolean approaching = event.hasCrossingWithStatus(ThresholdStatus.APPROACHING);
    if (exceeded && ci >= 4) {
      return AlertLevel.SYSTEMIC;
    }
    if (exceeded && ci >= 3) {
      return AlertLevel.CRITICAL;
    }
    if (exceeded) {
      return AlertLevel.ALERT;
    }
    if (approaching || ci >= 2) {
      return AlertLevel.MONITOR;
    }
    return AlertLevel.WATCH;
  }
}
