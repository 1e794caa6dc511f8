/**
 * Command-line entry points: {@code recstream run} and {@code recstream stages}.
 * <p>Arguments are {@code key=value} tokens plus {@code --flags}; failures map to {@link
 * ca.gc.cra.recstream.api.ExitCode} values and are logged rather than thrown.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.api;
