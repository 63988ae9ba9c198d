package org.smae.config;

import java.time.LocalDate;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smae.application.pipeline.AnalyticalPipeline;
import org.smae.application.pipeline.PipelineResult;
import org.smae.application.port.ClockPort;

/**
 * One bounded pipeline run followed by release of every registered source adapter.
 *
 * @since 0.1.0
 */
public final class PipelineSession {
  private static final Logger log = LoggerFactory.getLogger(PipelineSession.class);

  private final AnalyticalPipeline pipeline;
  private final PipelineConfig config;
  private final ClockPort clock;

  PipelineSession(AnalyticalPipeline pipeline, PipelineConfig config, ClockPort clock) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public AnalyticalPipeline pipeline() {
    return pipeline;
  }

  /**
   * Runs over the configured lookback window ending today.
   *
   * @return pipeline result
   * @throws Exception if the run fails or an adapter cannot be closed
   */
  public PipelineResult runAndClose() throws Exception {
    return runAndClose(config.since(clock.today()));
  }

  /**
   * Runs once and closes every registered adapter, whatever the outcome of the run.
   * <p>A close failure after a failed run is attached to the run failure as suppressed.</p>
   *
   * @param since lookback lower bound
   * @return pipeline result
   * @throws Exception if the run fails or an adapter cannot be closed
   */
  public PipelineResult runAndClose(LocalDate since) throws Exception {
    Exception failure = null;
    PipelineResult result = null;
    try {
      result = pipeline.run(since);
    } catch (Exception ex) {
      failure = ex;
      log.error("Pipeline run failed", ex);
    } finally {
      try {
        pipeline.registry().closeAll();
      } catch (Exception closeEx) {
        if (failure != null) {
          failure.addSuppressed(closeEx);
          log.error("Source close failure (suppressed)", closeEx);
        } else {
          failure = closeEx;
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
    return result;
  }
}
