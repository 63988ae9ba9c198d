package org.smae.application.intake;

import java.util.List;
import org.smae.domain.events.Event;

/**
 * Result of one intake pass: the concatenated events in source-registration order and the per-run error log.
 *
 * @param events events fetched from successful sources
 * @param errors one entry per failed source, in registration order
 * @param sourceCount number of sources invoked
 * @since 0.1.0
 */
public record IntakeReport(List<Event> events, List<SourceError> errors, int sourceCount) {
  public IntakeReport {
    events = events == null ? List.of() : List.copyOf(events);
    errors = errors == null ? List.of() : List.copyOf(errors);
    if (sourceCount < 0) {
      throw new IllegalArgumentException("sourceCount must be non-negative");
    }
  }

  /**
   * Returns an empty report for a run without registered sources.
   *
   * @return empty report
   */
  public static IntakeReport empty() {
    return new IntakeReport(List.of(), List.of(), 0);
  }

  /**
   * Indicates whether at least one source was invoked and every one of them failed.
   *
   * @return {@code true} when all invoked sources failed
   */
  public boolean allSourcesFailed() {
    return sourceCount > 0 && errors.size() == sourceCount;
  }
}
