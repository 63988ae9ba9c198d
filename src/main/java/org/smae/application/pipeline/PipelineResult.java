package org.smae.application.pipeline;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import org.smae.application.intake.SourceError;
import org.smae.domain.convergence.ConvergenceScore;
import org.smae.domain.events.Event;
import org.smae.domain.threshold.ThresholdCrossing;

/**
 * Immutable outcome of one pipeline run.
 *
 * @param runDate date of the run, from the pipeline clock
 * @param events triaged and verified events
 * @param thresholdCrossings every crossing with status EXCEEDED, in event order
 * @param convergenceNodes scores with {@code ciScore >= 2}
 * @param alertEvents events at ALERT or above
 * @param executiveSummary one-paragraph summary of the run
 * @param sourceErrors intake error log of the run
 * @param sourceCount number of sources invoked by intake
 * @since 0.1.0
 */
public record PipelineResult(
    LocalDate runDate,
    List<Event> events,
    List<ThresholdCrossing> thresholdCrossings,
    List<ConvergenceScore> convergenceNodes,
    List<Event> alertEvents,
    String executiveSummary,
    List<SourceError> sourceErrors,
    int sourceCount) {

  public PipelineResult {
    Objects.requireNonNull(runDate, "runDate");
    events = List.copyOf(events);
    thresholdCrossings = List.copyOf(thresholdCrossings);
    convergenceNodes = List.copyOf(convergenceNodes);
    alertEvents = List.copyOf(alertEvents);
    executiveSummary = Objects.requireNonNull(executiveSummary, "executiveSummary");
    sourceErrors = List.copyOf(sourceErrors);
  }

  /**
   * Distinguishes "every source failed" from "nothing matched".
   *
   * @return {@code true} when at least one source was invoked and all of them failed
   */
  public boolean allSourcesFailed() {
    return sourceCount > 0 && sourceErrors.size() == sourceCount;
  }
}
