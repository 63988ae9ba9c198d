package org.smae.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @BeforeEach
  void rememberProperty() {
    previousExporter = System.getProperty("otel.metrics.exporter");
  }

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void configuredNoneYieldsNoop() {
    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize("none", null)) {
      assertTrue(result.isNoop());
    }
  }

  @Test
  void systemPropertyUsedWhenConfigSilent() {
    System.setProperty("otel.metrics.exporter", "none");

    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(null, null)) {
      assertTrue(result.isNoop());
    }
  }

  @Test
  void configuredValueBeatsSystemProperty() {
    System.setProperty("otel.metrics.exporter", "otlp");

    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize("none", null)) {
      assertTrue(result.isNoop());
    }
  }

  @Test
  void otlpExporterBuildsActiveProvider() {
    try (OpenTelemetryBootstrap.BootstrapResult result =
        OpenTelemetryBootstrap.initialize("otlp", "http://127.0.0.1:4317")) {
      assertFalse(result.isNoop());
    }
  }

  @Test
  void exporterModeParsing() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from(" None "));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(null));
  }

  @Test
  void firstNonBlankFallsThroughToDefault() {
    assertEquals("b", OpenTelemetryBootstrap.firstNonBlank(null, " b ", "default"));
    assertEquals("default", OpenTelemetryBootstrap.firstNonBlank(null, "  ", "default"));
  }
}
