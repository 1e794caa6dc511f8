/**
 * Builtin record stages and the catalog that resolves them by name.
 * <p>Stages read records (decoding JSON lines on the way in), evaluate
 * {@link ca.gc.cra.recstream.application.expression.RecordExpression} arguments, and push to their downstream
 * synchronously. Buffering stages ({@code sort}, {@code totable}) emit on finish.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.infrastructure.stage;
