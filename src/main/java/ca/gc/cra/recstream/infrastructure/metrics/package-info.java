/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.recstream.application.port.MetricsPort}.
 * <p>Exporter selection follows {@link ca.gc.cra.recstream.infrastructure.metrics.TelemetrySettings}; the default
 * is {@code none}, which keeps a noop meter.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.infrastructure.metrics;
