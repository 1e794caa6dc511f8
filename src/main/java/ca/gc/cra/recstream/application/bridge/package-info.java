/**
 * <strong>Purpose:</strong> Bridge between host-language closures and the textual argument channel of stages.
 * <p><strong>Pipeline role:</strong> Runs at chain compilation, before records flow.</p>
 * <p><strong>Concurrency:</strong> Registries are owned by one runner and are not thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.application.bridge;
