package org.smae.application.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.smae.domain.convergence.ConvergenceScore;
import org.smae.domain.events.Event;

/**
 * Produces one unweighted convergence score per event, in event order.
 *
 * @since 0.1.0
 */
public final class ConvergenceScorer {

  public List<ConvergenceScore> score(List<Event> events) {
    Objects.requireNonNull(events, "events");
    List<ConvergenceScore> scores = new ArrayList<>(events.size());
    for (Event event : events) {
      scores.add(ConvergenceScore.of(event));
    }
    return List.copyOf(scores);
  }
}
