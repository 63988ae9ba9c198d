package org.smae.application.pipeline;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.smae.application.intake.IntakeReport;
import org.smae.domain.convergence.ConvergenceScore;
import org.smae.domain.events.Event;
import org.smae.domain.ontology.MetabolicNetwork;
import org.smae.domain.threshold.ThresholdCrossing;

/**
 * Builds the executive summary sentence attached to a pipeline result.
 */
final class ExecutiveSummary {
  static final String NO_EVENTS =
      "No events ingested. Configure data source adapters to populate briefings.";

  private ExecutiveSummary() {}

  static String of(
      List<Event> events,
      List<ThresholdCrossing> exceeded,
      List<ConvergenceScore> convergenceNodes,
      IntakeReport intake) {
    if (events.isEmpty()) {
      if (intake.allSourcesFailed()) {
        return "No events ingested: all " + intake.sourceCount() + " registered sources failed.";
      }
      return withFailures(new StringBuilder(NO_EVENTS), intake);
    }
    Set<MetabolicNetwork> networks = EnumSet.noneOf(MetabolicNetwork.class);
    for (Event event : events) {
      networks.addAll(event.networks());
    }
    StringBuilder summary = new StringBuilder()
        .append(events.size()).append(" events analyzed across ")
        .append(networks.size()).append(" metabolic networks. ")
        .append(exceeded.size()).append(" threshold crossings detected. ")
        .append(convergenceNodes.size()).append(" convergence nodes identified.");
    return withFailures(summary, intake);
  }

  private static String withFailures(StringBuilder summary, IntakeReport intake) {
    int failed = intake.errors().size();
    if (failed > 0) {
      summary.append(' ').append(failed).append(" of ").append(intake.sourceCount())
          .append(" sources failed during intake.");
    }
    return summary.toString();
  }
}
