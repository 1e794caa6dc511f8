/**
 * <strong>Purpose:</strong> Host-language callbacks usable as stage arguments and their registry keys.
 * <p><strong>Pipeline role:</strong> Domain types shared by the builder, the bridge, and expression evaluation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.domain.function;
