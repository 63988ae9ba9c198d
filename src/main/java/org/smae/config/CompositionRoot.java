package org.smae.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smae.application.intake.SourceIntake;
import org.smae.application.intake.SourceRegistry;
import org.smae.application.pipeline.AnalyticalPipeline;
import org.smae.application.port.ClockPort;
import org.smae.application.port.MetricsPort;
import org.smae.application.port.SourceGateway;
import org.smae.infrastructure.exec.ExecutorFactories;
import org.smae.infrastructure.metrics.NoOpMetricsAdapter;
import org.smae.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.smae.infrastructure.time.SystemClockAdapter;
import org.smae.logging.LoggingConfigurator;

/**
 * <strong>What:</strong> Wires configuration to the metrics adapter, clock, intake pool and analytical pipeline.
 * <p><strong>Why:</strong> One explicit place builds the service graph; nothing in the pipeline reaches for
 * globals.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup.</p>
 *
 * @since 0.1.0
 * @see PipelineSession
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  static final String CONFIG_SECTION = "pipeline";

  private final PipelineConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Builds the graph from configuration, selecting the metrics adapter from {@code metricsExporter}.
   *
   * @param config validated configuration
   */
  public CompositionRoot(PipelineConfig config) {
    this(config, new SystemClockAdapter(), createMetrics(config));
  }

  /**
   * Builds the graph with explicit clock and metrics collaborators.
   *
   * @param config validated configuration
   * @param clock run-date clock
   * @param metrics metrics sink
   */
  public CompositionRoot(PipelineConfig config, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
  }

  /**
   * Loads configuration from the {@code pipeline} section of a YAML file, applying overrides on top.
   *
   * @param yamlPath YAML file; a missing file means defaults plus overrides
   * @param overrides highest-precedence key/value pairs
   * @return validated configuration
   * @throws IOException if the file exists but cannot be read
   */
  public static PipelineConfig loadConfig(Path yamlPath, Map<String, String> overrides) throws IOException {
    Optional<Map<String, String>> yaml = YamlConfigLoader.load(yamlPath, CONFIG_SECTION);
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        CONFIG_SECTION, yaml, overrides, PipelineConfig.defaults().asFlatMap(), log::warn);
    return PipelineConfig.fromMap(effective);
  }

  public PipelineConfig config() {
    return config;
  }

  public ClockPort clock() {
    return clock;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Creates a pipeline with an empty registry and a per-run intake pool.
   *
   * @return new pipeline
   */
  public AnalyticalPipeline pipeline() {
    String prefix = config.intakeThreadPrefix();
    SourceIntake intake = new SourceIntake(
        size -> ExecutorFactories.newIntakePool(size, prefix,
            (thread, ex) -> log.error("Uncaught exception in intake worker {}", thread.getName(), ex)),
        metrics);
    return new AnalyticalPipeline(new SourceRegistry(), intake, clock, metrics);
  }

  /**
   * Creates a session over a new pipeline with the given sources registered in order.
   *
   * @param sources feed adapters
   * @return session ready to run once
   */
  public PipelineSession session(SourceGateway... sources) {
    AnalyticalPipeline pipeline = pipeline();
    for (SourceGateway source : sources) {
      pipeline.registerSource(source);
    }
    return new PipelineSession(pipeline, config, clock);
  }

  /**
   * Flushes and releases the metrics adapter when it holds exporter resources.
   */
  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private static MetricsPort createMetrics(PipelineConfig config) {
    if ("none".equals(config.metricsExporter())) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otelEndpoint());
  }
}
