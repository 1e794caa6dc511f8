/**
 * <strong>Purpose:</strong> The structured record flowing between stages.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.domain.record;
