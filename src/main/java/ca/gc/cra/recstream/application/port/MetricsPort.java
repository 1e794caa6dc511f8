package ca.gc.cra.recstream.application.port;

/**
 * <strong>What:</strong> Domain port abstracting metrics emission.
 * <p><strong>Why:</strong> Lets the runner and bridge record counters and latency observations without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates from independent runners.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code pipeline.run.latencyNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code pipeline.run.completed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, unit counts)
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates; useful for tests and embedded use.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
