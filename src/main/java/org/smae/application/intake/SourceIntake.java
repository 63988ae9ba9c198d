package org.smae.application.intake;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.smae.application.port.MetricsPort;
import org.smae.application.port.SourceGateway;
import org.smae.domain.events.Event;
import org.smae.logging.Logs;

/**
 * <strong>What:</strong> Fetches events from every registered source concurrently and joins them in registration
 * order.
 * <p><strong>Why:</strong> A slow or failing feed must neither block nor abort the others; failures become entries
 * of the run's error log instead.</p>
 * <p><strong>Role:</strong> First stage of the analytical pipeline.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each call owns its worker pool.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code source} on worker threads; emits
 * {@code intake.source.success}, {@code intake.source.failure} and {@code intake.events.fetched}.</p>
 *
 * @since 0.1.0
 */
public final class SourceIntake {
  private static final Logger log = LoggerFactory.getLogger(SourceIntake.class);
  static final int MAX_DESCRIPTION_BYTES = 512;
  static final String INTERRUPTED_DESCRIPTION = "intake interrupted";
  private static final String MDC_SOURCE = "source";

  private final IntFunction<ExecutorService> poolFactory;
  private final MetricsPort metrics;

  /**
   * Creates the intake stage.
   *
   * @param poolFactory creates a pool with the requested number of threads; called once per run
   * @param metrics metrics sink
   */
  public SourceIntake(IntFunction<ExecutorService> poolFactory, MetricsPort metrics) {
    this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Invokes every source with the lookback date and waits for all of them to settle.
   *
   * @param sources sources in registration order
   * @param since lower bound on event date passed to each source
   * @return events from successful sources plus one error per failed source; never throws for source failures
   */
  public IntakeReport collect(List<SourceGateway> sources, LocalDate since) {
    Objects.requireNonNull(sources, "sources");
    Objects.requireNonNull(since, "since");
    if (sources.isEmpty()) {
      log.info("No sources registered; intake produced no events");
      return IntakeReport.empty();
    }

    ExecutorService executor = poolFactory.apply(sources.size());
    List<Future<FetchOutcome>> futures = new ArrayList<>(sources.size());
    try {
      for (SourceGateway source : sources) {
        futures.add(executor.submit(fetchTask(source, since)));
      }
      IntakeReport report = join(sources, futures);
      if (report.allSourcesFailed()) {
        log.error("All {} registered sources failed during intake", sources.size());
      } else {
        log.info("Intake collected {} events from {} sources ({} failed)",
            report.events().size(), sources.size(), report.errors().size());
      }
      return report;
    } finally {
      executor.shutdownNow();
    }
  }

  private Callable<FetchOutcome> fetchTask(SourceGateway source, LocalDate since) {
    String name = source.name();
    return () -> {
      String previousSource = MDC.get(MDC_SOURCE);
      try {
        MDC.put(MDC_SOURCE, name);
        log.debug("Fetching events from {} since {}", name, since);
        List<Event> fetched = source.fetchEvents(since);
        List<Event> events = fetched == null ? List.of() : List.copyOf(fetched);
        metrics.increment("intake.source.success");
        metrics.observe("intake.events.fetched", events.size());
        log.debug("Source {} returned {} events", name, events.size());
        return FetchOutcome.success(events);
      } catch (Exception ex) {
        metrics.increment("intake.source.failure");
        String description = Logs.describe(ex, MAX_DESCRIPTION_BYTES);
        log.warn("Source {} failed during intake: {}", name, description);
        log.debug("Source {} failure detail", name, ex);
        return FetchOutcome.failure(new SourceError(name, description));
      } finally {
        if (previousSource == null) {
          MDC.remove(MDC_SOURCE);
        } else {
          MDC.put(MDC_SOURCE, previousSource);
        }
      }
    };
  }

  private IntakeReport join(List<SourceGateway> sources, List<Future<FetchOutcome>> futures) {
    List<Event> events = new ArrayList<>();
    List<SourceError> errors = new ArrayList<>();
    boolean interrupted = false;
    for (int i = 0; i < futures.size(); i++) {
      String name = sources.get(i).name();
      Future<FetchOutcome> future = futures.get(i);
      FetchOutcome outcome;
      if (interrupted) {
        outcome = settledOrInterrupted(name, future);
      } else {
        try {
          outcome = future.get();
        } catch (InterruptedException ex) {
          interrupted = true;
          log.warn("Intake interrupted while waiting for {}; cancelling outstanding fetches", name);
          futures.forEach(f -> f.cancel(true));
          outcome = settledOrInterrupted(name, future);
        } catch (ExecutionException ex) {
          outcome = unexpectedFailure(name, ex.getCause());
        }
      }
      if (outcome.error() != null) {
        errors.add(outcome.error());
      } else {
        events.addAll(outcome.events());
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return new IntakeReport(events, errors, sources.size());
  }

  private FetchOutcome settledOrInterrupted(String name, Future<FetchOutcome> future) {
    if (future.isDone() && !future.isCancelled()) {
      try {
        return future.get();
      } catch (ExecutionException ex) {
        return unexpectedFailure(name, ex.getCause());
      } catch (InterruptedException | CancellationException ex) {
        // fall through to the interrupted outcome
        log.debug("Source {} did not settle before interruption", name, ex);
      }
    }
    metrics.increment("intake.source.failure");
    return FetchOutcome.failure(new SourceError(name, INTERRUPTED_DESCRIPTION));
  }

  private FetchOutcome unexpectedFailure(String name, Throwable cause) {
    metrics.increment("intake.source.failure");
    String description = Logs.describe(cause, MAX_DESCRIPTION_BYTES);
    log.warn("Source {} failed during intake: {}", name, description);
    return FetchOutcome.failure(new SourceError(name, description));
  }

  private record FetchOutcome(List<Event> events, SourceError error) {
    static FetchOutcome success(List<Event> events) {
      return new FetchOutcome(events, null);
    }

    static FetchOutcome failure(SourceError error) {
      return new FetchOutcome(List.of(), error);
    }
  }
}
