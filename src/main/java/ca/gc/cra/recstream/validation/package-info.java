/**
 * <strong>Purpose:</strong> Validation helpers for CLI arguments and configuration values.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.validation;
