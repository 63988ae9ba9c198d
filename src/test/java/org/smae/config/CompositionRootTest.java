package org.smae.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.smae.domain.ontology.MetabolicNetwork.CARBON;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.smae.application.analysis.UntaggedNetworkException;
import org.smae.application.pipeline.PipelineResult;
import org.smae.application.port.ClockPort;
import org.smae.infrastructure.metrics.NoOpMetricsAdapter;
import org.smae.testutil.EventFixtures;
import org.smae.testutil.FakeSourceGateway;
import org.smae.testutil.RecordingMetrics;

class CompositionRootTest {
  private static final ClockPort FIXED_CLOCK = () -> Instant.parse("2025-03-15T08:00:00Z");

  @TempDir Path tempDir;

  @Test
  void loadConfigAppliesPrecedence() throws IOException {
    Path yaml = tempDir.resolve("smae.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        pipeline:
          lookbackDays: 10
          intakeThreadPrefix: feeds
        """);

    PipelineConfig config = CompositionRoot.loadConfig(yaml, Map.of("lookbackDays", "4"));

    assertEquals(4, config.lookbackDays());
    assertEquals("feeds", config.intakeThreadPrefix());
    assertEquals("none", config.metricsExporter());
  }

  @Test
  void missingYamlFallsBackToDefaults() throws IOException {
    PipelineConfig config = CompositionRoot.loadConfig(tempDir.resolve("absent.yaml"), Map.of());

    assertEquals(PipelineConfig.defaults(), config);
  }

  @Test
  void exporterNoneSelectsNoOpMetrics() {
    PipelineConfig config = new PipelineConfig(2, "smae-intake", "none", null, false);

    try (CompositionRoot root = new CompositionRoot(config)) {
      assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
    }
  }

  @Test
  void sessionRunsOverConfiguredLookbackAndClosesSources() throws Exception {
    PipelineConfig config = new PipelineConfig(3, "smae-intake", "none", null, false);
    FakeSourceGateway acled = FakeSourceGateway.returning("acled", EventFixtures.tagged("a-1", CARBON));
    FakeSourceGateway idmc = FakeSourceGateway.returning("idmc");
    CompositionRoot root = new CompositionRoot(config, FIXED_CLOCK, new RecordingMetrics());

    PipelineResult result = root.session(acled, idmc).runAndClose();

    assertEquals(1, result.events().size());
    assertEquals(LocalDate.of(2025, 3, 12), acled.requestedSince());
    assertTrue(acled.isClosed() && idmc.isClosed());
  }

  @Test
  void sessionClosesSourcesWhenRunFails() {
    PipelineConfig config = PipelineConfig.defaults();
    IOException closeFailure = new IOException("socket already closed");
    FakeSourceGateway bad = FakeSourceGateway.returning("acled", EventFixtures.event("untagged").build())
        .failingOnClose(closeFailure);
    CompositionRoot root = new CompositionRoot(config, FIXED_CLOCK, new RecordingMetrics());

    UntaggedNetworkException ex = assertThrows(UntaggedNetworkException.class,
        () -> root.session(bad).runAndClose(LocalDate.of(2025, 3, 1)));

    assertTrue(bad.isClosed());
    assertSame(closeFailure, ex.getSuppressed()[0]);
  }

  @Test
  void closeFailureAfterSuccessfulRunIsRethrown() {
    IOException closeFailure = new IOException("socket already closed");
    FakeSourceGateway source = FakeSourceGateway.returning("acled").failingOnClose(closeFailure);
    CompositionRoot root = new CompositionRoot(PipelineConfig.defaults(), FIXED_CLOCK, new RecordingMetrics());

    IOException thrown = assertThrows(IOException.class, () -> root.session(source).runAndClose());

    assertSame(closeFailure, thrown);
  }
}
