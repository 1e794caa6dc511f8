package ca.gc.cra.recstream.infrastructure.metrics;

import java.util.Locale;

/**
 * Metrics exporter settings. Blank values fall back to the standard {@code otel.*} system properties and
 * {@code OTEL_*} environment variables, then to the defaults below.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes comma-separated {@code key=value} resource attributes
 * @since 0.1.0
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  /** Exporter used when nothing is configured. */
  public static final String DEFAULT_EXPORTER = "none";
  /** OTLP endpoint used when nothing is configured. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /**
   * Settings with every value left to system properties, environment, or defaults.
   *
   * @return unset settings
   */
  public static TelemetrySettings fromEnvironment() {
    return new TelemetrySettings(null, null, null);
  }

  TelemetrySettings resolve() {
    String resolvedExporter = firstNonBlank(exporter,
        System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), DEFAULT_EXPORTER);
    String resolvedEndpoint = firstNonBlank(endpoint,
        System.getProperty("otel.exporter.otlp.endpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
        DEFAULT_ENDPOINT);
    String resolvedAttributes = firstNonBlank(resourceAttributes,
        System.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
    return new TelemetrySettings(resolvedExporter.toLowerCase(Locale.ROOT), resolvedEndpoint, resolvedAttributes);
  }

  private static String firstNonBlank(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return "";
  }
}
