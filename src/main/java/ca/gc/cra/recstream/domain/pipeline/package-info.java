/**
 * <strong>Purpose:</strong> Declarative pipeline model: stage calls, their arguments, and the immutable builder.
 * <p><strong>Pipeline role:</strong> Domain layer; compiled into a chain by the application layer.
 * <p><strong>Concurrency:</strong> All types are immutable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.domain.pipeline;
