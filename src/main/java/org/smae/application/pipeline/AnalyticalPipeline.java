package org.smae.application.pipeline;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smae.application.analysis.ConvergenceScorer;
import org.smae.application.analysis.EventValidationException;
import org.smae.application.analysis.ResistanceLinker;
import org.smae.application.analysis.SourceVerifier;
import org.smae.application.analysis.TagValidator;
import org.smae.application.analysis.ThresholdEvaluator;
import org.smae.application.analysis.TriagePolicy;
import org.smae.application.intake.IntakeReport;
import org.smae.application.intake.SourceError;
import org.smae.application.intake.SourceIntake;
import org.smae.application.intake.SourceRegistry;
import org.smae.application.port.ClockPort;
import org.smae.application.port.MetricsPort;
import org.smae.application.port.SourceGateway;
import org.smae.domain.convergence.ConvergenceScore;
import org.smae.domain.events.AlertLevel;
import org.smae.domain.events.Event;
import org.smae.domain.threshold.ThresholdCrossing;
import org.smae.domain.threshold.ThresholdStatus;

/**
 * <strong>What:</strong> Runs the seven analytical stages over one bounded batch and assembles the result.
 * <p><strong>Stages:</strong> intake, tag, threshold, converge, resistance-link, triage, verify.</p>
 * <p><strong>Failure model:</strong> source failures are isolated by intake and surface through
 * {@link #sourceErrors()} and the result; tagging failures abort the run with no partial result.</p>
 * <p><strong>Thread-safety:</strong> Runs are expected to be sequential; the error snapshot is published
 * atomically and may be read from any thread.</p>
 * <p><strong>Observability:</strong> Emits {@code pipeline.run.*}, {@code pipeline.tag.rejected},
 * {@code triage.level.<level>} and {@code verify.events.provisional}.</p>
 *
 * @since 0.1.0
 */
public final class AnalyticalPipeline {
  private static final Logger log = LoggerFactory.getLogger(AnalyticalPipeline.class);

  private final SourceRegistry registry;
  private final SourceIntake intake;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final TagValidator tagValidator = new TagValidator();
  private final ThresholdEvaluator thresholdEvaluator = new ThresholdEvaluator();
  private final ConvergenceScorer convergenceScorer = new ConvergenceScorer();
  private final ResistanceLinker resistanceLinker = new ResistanceLinker();
  private final TriagePolicy triagePolicy = new TriagePolicy();
  private final SourceVerifier sourceVerifier = new SourceVerifier();

  private volatile List<SourceError> lastErrors = List.of();

  /**
   * Creates a pipeline.
   *
   * @param registry sources taking part in each run
   * @param intake concurrent intake stage
   * @param clock source of the run date
   * @param metrics metrics sink
   */
  public AnalyticalPipeline(SourceRegistry registry, SourceIntake intake, ClockPort clock, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.intake = Objects.requireNonNull(intake, "intake");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Appends a source to the registry.
   *
   * @param source adapter to register
   */
  public void registerSource(SourceGateway source) {
    registry.register(source);
  }

  /**
   * @return the registry backing this pipeline; closed by the owning session after each run
   */
  public SourceRegistry registry() {
    return registry;
  }

  /**
   * Returns the error log of the most recent intake.
   *
   * @return immutable snapshot; empty before the first run
   */
  public List<SourceError> sourceErrors() {
    return lastErrors;
  }

  /**
   * Executes every stage over events dated on or after {@code since}.
   *
   * @param since lookback lower bound passed to each source
   * @return immutable result
   * @throws EventValidationException if any ingested event lacks a network or layer
   */
  public PipelineResult run(LocalDate since) {
    Objects.requireNonNull(since, "since");
    metrics.increment("pipeline.run.started");
    long started = System.nanoTime();
    LocalDate runDate = clock.today();
    log.info("Pipeline run {} started with {} sources, lookback since {}", runDate, registry.size(), since);

    IntakeReport report = intakeReport(since);
    List<Event> events = tag(report.events());
    events = evaluateThresholds(events);
    List<ConvergenceScore> scores = scoreConvergence(events);
    events = linkResistance(events);
    events = triage(events, scores);
    events = verify(events);

    PipelineResult result = assemble(runDate, events, scores, report);
    metrics.increment("pipeline.run.completed");
    metrics.observe("pipeline.run.latencyMillis", (System.nanoTime() - started) / 1_000_000L);
    log.info("Pipeline run {} completed: {}", runDate, result.executiveSummary());
    return result;
  }

  /**
   * Intake stage: fetches from every registered source and replaces the error log.
   *
   * @param since lookback lower bound
   * @return events in source-registration order
   */
  public List<Event> intake(LocalDate since) {
    return intakeReport(since).events();
  }

  /**
   * Tag stage.
   *
   * @param events ingested events
   * @return the events unchanged
   * @throws EventValidationException if any event lacks a network or layer
   */
  public List<Event> tag(List<Event> events) {
    try {
      return tagValidator.validate(events);
    } catch (EventValidationException ex) {
      metrics.increment("pipeline.tag.rejected");
      throw ex;
    }
  }

  /**
   * Threshold stage: classifies every crossing against its bound.
   *
   * @param events tagged events
   * @return events whose crossings carry a computed status
   */
  public List<Event> evaluateThresholds(List<Event> events) {
    return thresholdEvaluator.evaluate(events);
  }

  /**
   * Convergence stage.
   *
   * @param events evaluated events
   * @return one unweighted score per event, in event order
   */
  public List<ConvergenceScore> scoreConvergence(List<Event> events) {
    return convergenceScorer.score(events);
  }

  /**
   * Resistance-link stage: marks events without a resistance summary as pending.
   *
   * @param events evaluated events
   * @return events with resistance placeholders filled in
   */
  public List<Event> linkResistance(List<Event> events) {
    return resistanceLinker.link(events);
  }

  /**
   * Triage stage.
   *
   * @param events events to grade
   * @param scores convergence scores keyed by event id
   * @return events with assigned alert levels
   */
  public List<Event> triage(List<Event> events, List<ConvergenceScore> scores) {
    List<Event> triaged = triagePolicy.triage(events, scores);
    for (Event event : triaged) {
      metrics.increment("triage.level." + event.alertLevel().name().toLowerCase(Locale.ROOT));
    }
    return triaged;
  }

  /**
   * Verify stage.
   *
   * @param events triaged events
   * @return events whose weakly corroborated sources are marked provisional
   */
  public List<Event> verify(List<Event> events) {
    List<Event> verified = sourceVerifier.verify(events);
    for (Event event : verified) {
      if (!event.sources().isEmpty() && sourceVerifier.needsCorroboration(event)) {
        metrics.increment("verify.events.provisional");
      }
    }
    return verified;
  }

  private IntakeReport intakeReport(LocalDate since) {
    IntakeReport report = intake.collect(registry.all(), since);
    lastErrors = report.errors();
    return report;
  }

  private static PipelineResult assemble(
      LocalDate runDate, List<Event> events, List<ConvergenceScore> scores, IntakeReport report) {
    List<ThresholdCrossing> exceeded = new ArrayList<>();
    List<Event> alertEvents = new ArrayList<>();
    for (Event event : events) {
      for (ThresholdCrossing crossing : event.thresholdCrossings()) {
        if (crossing.status() == ThresholdStatus.EXCEEDED) {
          exceeded.add(crossing);
        }
      }
      if (event.alertLevel().isAtLeast(AlertLevel.ALERT)) {
        alertEvents.add(event);
      }
    }
    List<ConvergenceScore> convergenceNodes = new ArrayList<>();
    for (ConvergenceScore score : scores) {
      if (score.ciScore() >= 2) {
        convergenceNodes.add(score);
      }
    }
    String summary = ExecutiveSummary.of(events, exceeded, convergenceNodes, report);
    return new PipelineResult(
        runDate, events, exceeded, convergenceNodes, alertEvents, summary, report.errors(), report.sourceCount());
  }
}
