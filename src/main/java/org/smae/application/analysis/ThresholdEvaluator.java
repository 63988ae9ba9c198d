package org.smae.application.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.smae.domain.events.Event;
import org.smae.domain.threshold.ThresholdCrossing;
import org.smae.domain.threshold.ThresholdMetric;

/**
 * Recomputes the status of every threshold crossing from its metric's current and threshold values.
 * <p>Pure and idempotent: evaluating an already evaluated batch yields equal events.</p>
 *
 * @since 0.1.0
 */
public final class ThresholdEvaluator {

  public List<Event> evaluate(List<Event> events) {
    Objects.requireNonNull(events, "events");
    List<Event> result = new ArrayList<>(events.size());
    for (Event event : events) {
      result.add(evaluate(event));
    }
    return List.copyOf(result);
  }

  Event evaluate(Event event) {
    if (event.thresholdCrossings().isEmpty()) {
      return event;
    }
    boolean changed = false;
    List<ThresholdCrossing> crossings = new ArrayList<>(event.thresholdCrossings().size());
    for (ThresholdCrossing crossing : event.thresholdCrossings()) {
      ThresholdMetric metric = crossing.metric();
      ThresholdCrossing evaluated = crossing.withMetric(metric.withStatus(metric.evaluatedStatus()));
      changed |= evaluated != crossing;
      crossings.add(evaluated);
    }
    return changed ? event.withThresholdCrossings(crossings) : event;
  }
}
