package org.smae.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PipelineConfigTest {

  @Test
  void defaults() {
    PipelineConfig config = PipelineConfig.defaults();

    assertEquals(2, config.lookbackDays());
    assertEquals("smae-intake", config.intakeThreadPrefix());
    assertEquals("otlp", config.metricsExporter());
    assertNull(config.otelEndpoint());
    assertFalse(config.verbose());
  }

  @Test
  void fromMapParsesAndNormalizes() {
    PipelineConfig config = PipelineConfig.fromMap(Map.of(
        "lookbackDays", " 30 ",
        "metricsExporter", "NONE",
        "otelEndpoint", "http://collector:4317",
        "verbose", "true"));

    assertEquals(30, config.lookbackDays());
    assertEquals("none", config.metricsExporter());
    assertEquals("http://collector:4317", config.otelEndpoint());
    assertTrue(config.verbose());
  }

  @Test
  void asFlatMapRoundTrips() {
    PipelineConfig config = new PipelineConfig(9, "feeds", "none", null, true);

    assertEquals(config, PipelineConfig.fromMap(config.asFlatMap()));
  }

  @Test
  void sinceSubtractsLookback() {
    assertEquals(LocalDate.of(2025, 3, 13), PipelineConfig.defaults().since(LocalDate.of(2025, 3, 15)));
  }

  @Test
  void rejectsOutOfRangeLookback() {
    assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(Map.of("lookbackDays", "366")));
    assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(Map.of("lookbackDays", "two")));
  }

  @Test
  void rejectsUnknownExporterAndUnsafePrefix() {
    assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromMap(Map.of("metricsExporter", "prometheus")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("intakeThreadPrefix", "smae intake")));
  }
}
