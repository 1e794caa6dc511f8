package ca.gc.cra.recstream.config;

import ca.gc.cra.recstream.application.bridge.HostFunctionRegistry;
import ca.gc.cra.recstream.application.pipeline.OutputPolicy;
import ca.gc.cra.recstream.application.port.MetricsPort;
import ca.gc.cra.recstream.validation.Numbers;
import ca.gc.cra.recstream.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings for a {@link ca.gc.cra.recstream.application.pipeline.PipelineRunner} and its metrics.
 *
 * @param textStagePrefix stage-name prefix that marks text-producing final stages
 * @param recordStages names that carry the prefix but still produce records
 * @param maxHostFunctions capacity of the runner's host-function registry
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otelEndpoint OTLP endpoint, or blank for the environment default
 * @param otelResourceAttributes comma-separated resource attributes, or blank
 * @since 0.1.0
 */
public record RunnerConfig(
    String textStagePrefix,
    Set<String> recordStages,
    int maxHostFunctions,
    String metricsExporter,
    String otelEndpoint,
    String otelResourceAttributes) {
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  public RunnerConfig {
    textStagePrefix = Strings.requireNonBlank("textStagePrefix", textStagePrefix);
    recordStages = Set.copyOf(Objects.requireNonNull(recordStages, "recordStages"));
    Numbers.requireRange("maxHostFunctions", maxHostFunctions, 1, Integer.MAX_VALUE);
    metricsExporter = Strings.requireNonBlank("metricsExporter", metricsExporter).toLowerCase(Locale.ROOT);
    if (!metricsExporter.equals("otlp") && !metricsExporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    otelEndpoint = otelEndpoint == null ? "" : otelEndpoint.trim();
    if (!otelEndpoint.isEmpty()) {
      validateEndpoint(otelEndpoint);
    }
    otelResourceAttributes = otelResourceAttributes == null ? "" : otelResourceAttributes.trim();
    if (!otelResourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", otelResourceAttributes,
          MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
  }

  /**
   * Returns the embedded defaults.
   *
   * @return default configuration
   */
  public static RunnerConfig defaults() {
    return fromMap(DefaultsForMode.asFlatMap("run"));
  }

  /**
   * Builds a configuration from a flat key/value map; missing keys take their defaults.
   *
   * @param values merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static RunnerConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");
    return new RunnerConfig(
        value(values, defaults, "textStagePrefix"),
        parseNames(value(values, defaults, "recordStages")),
        Numbers.parseIntInRange("maxHostFunctions", value(values, defaults, "maxHostFunctions"),
            1, Integer.MAX_VALUE),
        value(values, defaults, "metricsExporter"),
        value(values, defaults, "otelEndpoint"),
        value(values, defaults, "otelResourceAttributes"));
  }

  /**
   * Builds the output policy described by {@link #textStagePrefix()} and {@link #recordStages()}.
   *
   * @return policy
   */
  public OutputPolicy outputPolicy() {
    return OutputPolicy.prefixed(textStagePrefix, recordStages);
  }

  /**
   * Creates an empty host-function registry with the configured capacity.
   *
   * @param metrics metrics sink for registrations
   * @return registry
   */
  public HostFunctionRegistry newRegistry(MetricsPort metrics) {
    return new HostFunctionRegistry(maxHostFunctions, metrics);
  }

  private static String value(Map<String, String> values, Map<String, String> defaults, String key) {
    String value = values.get(key);
    return value != null ? value : defaults.getOrDefault(key, "");
  }

  private static Set<String> parseNames(String raw) {
    Set<String> names = new LinkedHashSet<>();
    Arrays.stream(raw.split(","))
        .map(String::trim)
        .filter(name -> !name.isEmpty())
        .map(name -> name.toLowerCase(Locale.ROOT))
        .forEach(names::add);
    return names;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
