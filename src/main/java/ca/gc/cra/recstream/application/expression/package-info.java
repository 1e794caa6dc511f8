/**
 * <strong>Purpose:</strong> Expression language stages use to evaluate per-record logic, including the
 * host-function invocation emitted by the bridge.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.application.expression;
