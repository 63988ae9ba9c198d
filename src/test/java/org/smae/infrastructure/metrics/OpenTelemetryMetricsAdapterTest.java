package org.smae.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithMetricKeyAttribute() {
    adapter.increment("intake.source.failure");
    adapter.increment("intake.source.failure");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "intake.source.failure");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("intake.source.failure", point.getAttributes().get(AttributeKey.stringKey("smae.metric.key")));
    assertEquals("smae", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("org.smae", counter.getInstrumentationScopeInfo().getName());
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("pipeline.run.latencyMillis", 40);
    adapter.observe("pipeline.run.latencyMillis", 60);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "pipeline.run.latencyMillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum(), 1e-9);
  }

  @Test
  void sanitizesInvalidNames() {
    assertEquals("triage.level.watch", OpenTelemetryMetricsAdapter.sanitizeName("triage.level.watch"));
    assertEquals("m1_bad_name", OpenTelemetryMetricsAdapter.sanitizeName("1 bad/name"));
    assertEquals("smae.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
