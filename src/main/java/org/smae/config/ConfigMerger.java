package org.smae.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and programmatic overrides with precedence overrides &gt; YAML &gt;
 * defaults.
 */
public final class ConfigMerger {
  private static final Set<String> KNOWN_KEYS =
      Set.of("lookbackDays", "intakeThreadPrefix", "metricsExporter", "otelEndpoint", "verbose");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param section configuration section the values belong to; used in diagnostics
   * @param yaml optional YAML-derived settings for the section
   * @param overrides key/value overrides (may be {@code null})
   * @param defaults embedded defaults
   * @param warn consumer invoked when an override shadows a YAML key or a key is not recognized
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged values fail {@link PipelineConfig} validation
   */
  public static Map<String, String> buildEffectiveConfig(
      String section,
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> overridesCopy = overrides == null ? Map.of() : overrides;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : overridesCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("Override replaces YAML value for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }
    if (warn != null) {
      for (String key : merged.keySet()) {
        if (!KNOWN_KEYS.contains(key)) {
          warn.accept("Ignoring unknown " + section + " key: " + key);
        }
      }
    }

    PipelineConfig.fromMap(merged);
    return Map.copyOf(merged);
  }
}
