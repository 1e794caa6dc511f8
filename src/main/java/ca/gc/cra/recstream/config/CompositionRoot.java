package ca.gc.cra.recstream.config;

import ca.gc.cra.recstream.application.pipeline.PipelineRunner;
import ca.gc.cra.recstream.application.port.MetricsPort;
import ca.gc.cra.recstream.infrastructure.json.JacksonRecordCodec;
import ca.gc.cra.recstream.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.recstream.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.recstream.infrastructure.stage.BuiltinStageCatalog;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the engine, JSON codec, builtin stage catalog, and metrics adapter from a {@link RunnerConfig}.
 *
 * <p>Owns the metrics adapter it creates; close the root when the process is done running pipelines.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final RunnerConfig config;
  private final JacksonRecordCodec codec = new JacksonRecordCodec();
  private final BuiltinStageCatalog catalog = BuiltinStageCatalog.create(codec);
  private OpenTelemetryMetricsAdapter metricsAdapter;

  /**
   * Creates a composition root.
   *
   * @param config runner configuration
   */
  public CompositionRoot(RunnerConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return configuration
   */
  public RunnerConfig config() {
    return config;
  }

  /**
   * Returns the shared JSON codec.
   *
   * @return codec
   */
  public JacksonRecordCodec codec() {
    return codec;
  }

  /**
   * Returns the builtin stage catalog.
   *
   * @return catalog
   */
  public BuiltinStageCatalog catalog() {
    return catalog;
  }

  /**
   * Returns the metrics port: an OpenTelemetry adapter when {@code metricsExporter=otlp}, otherwise noop.
   *
   * @return metrics port
   */
  public synchronized MetricsPort metrics() {
    if (!"otlp".equals(config.metricsExporter())) {
      return MetricsPort.NO_OP;
    }
    if (metricsAdapter == null) {
      metricsAdapter = new OpenTelemetryMetricsAdapter(
          new TelemetrySettings(config.metricsExporter(), config.otelEndpoint(), config.otelResourceAttributes()));
    }
    return metricsAdapter;
  }

  /**
   * Creates a runner with its own host-function registry.
   *
   * @return new runner
   */
  public PipelineRunner pipelineRunner() {
    MetricsPort metrics = metrics();
    return new PipelineRunner(catalog, codec, config.outputPolicy(), config.newRegistry(metrics), metrics);
  }

  /**
   * Flushes and closes the metrics adapter, when one was created.
   */
  @Override
  public synchronized void close() {
    if (metricsAdapter != null) {
      metricsAdapter.forceFlush();
      metricsAdapter.close();
      log.debug("Metrics adapter closed");
      metricsAdapter = null;
    }
  }
}
