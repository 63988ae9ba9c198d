package org.smae.config;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.smae.validation.Numbers;
import org.smae.validation.Strings;

/**
 * <strong>What:</strong> Immutable settings for one SMAE pipeline process.
 * <p><strong>Why:</strong> Keeps runs reproducible by normalizing lookback, thread naming and metrics export in one
 * validated place.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param lookbackDays number of days before the run date that sources are asked to cover (1..365)
 * @param intakeThreadPrefix thread-name prefix for intake workers
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint optional OTLP endpoint; {@code null} defers to the environment
 * @param verbose whether DEBUG logging is enabled at startup
 * @since 0.1.0
 */
public record PipelineConfig(
    int lookbackDays,
    String intakeThreadPrefix,
    String metricsExporter,
    String otelEndpoint,
    boolean verbose) {

  static final int DEFAULT_LOOKBACK_DAYS = 2;
  static final String DEFAULT_THREAD_PREFIX = "smae-intake";
  static final String DEFAULT_EXPORTER = "otlp";

  public PipelineConfig {
    Numbers.requireRange("lookbackDays", lookbackDays, 1, 365);
    intakeThreadPrefix = Strings.sanitizeNamePrefix("intakeThreadPrefix", intakeThreadPrefix);
    metricsExporter = normalizeExporter(metricsExporter);
    otelEndpoint = Strings.trimToNull(otelEndpoint);
  }

  /**
   * Returns the embedded defaults.
   *
   * @return default configuration
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(DEFAULT_LOOKBACK_DAYS, DEFAULT_THREAD_PREFIX, DEFAULT_EXPORTER, null, false);
  }

  /**
   * Builds a configuration from flat key/value pairs; absent keys take their defaults.
   *
   * @param kv merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    PipelineConfig defaults = defaults();
    int lookback = parseInt(kv.get("lookbackDays"), defaults.lookbackDays(), "lookbackDays");
    String prefix = valueOrDefault(kv.get("intakeThreadPrefix"), defaults.intakeThreadPrefix());
    String exporter = valueOrDefault(kv.get("metricsExporter"), defaults.metricsExporter());
    String endpoint = kv.get("otelEndpoint");
    boolean verbose = parseBoolean(kv.get("verbose"), defaults.verbose());
    return new PipelineConfig(lookback, prefix, exporter, endpoint, verbose);
  }

  /**
   * Renders this configuration as the flat map understood by {@link #fromMap(Map)}.
   *
   * @return ordered, unmodifiable map
   */
  public Map<String, String> asFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("lookbackDays", Integer.toString(lookbackDays));
    map.put("intakeThreadPrefix", intakeThreadPrefix);
    map.put("metricsExporter", metricsExporter);
    if (otelEndpoint != null) {
      map.put("otelEndpoint", otelEndpoint);
    }
    map.put("verbose", Boolean.toString(verbose));
    return Collections.unmodifiableMap(map);
  }

  /**
   * Computes the lookback lower bound for a run on {@code today}.
   *
   * @param today run date
   * @return {@code today - lookbackDays}
   */
  public LocalDate since(LocalDate today) {
    return Objects.requireNonNull(today, "today").minusDays(lookbackDays);
  }

  private static String normalizeExporter(String raw) {
    String value = raw == null || raw.isBlank() ? DEFAULT_EXPORTER : raw.trim().toLowerCase(Locale.ROOT);
    if (!value.equals("otlp") && !value.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + raw + ")");
    }
    return value;
  }

  private static String valueOrDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static int parseInt(String raw, int fallback, String key) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
