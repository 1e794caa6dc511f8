package ca.gc.cra.recstream.domain.function;

import ca.gc.cra.recstream.domain.record.Record;
import java.util.Objects;

/**
 * <strong>What:</strong> Caller-supplied closure that a stage can invoke on the current record.
 * <p><strong>Why:</strong> Stage arguments are textual; host functions let callers pass Java logic where a stage
 * would otherwise expect an expression.</p>
 * <p><strong>Role:</strong> Domain callback bridged into stage arguments by the host-function bridge.</p>
 * <p><strong>Thread-safety:</strong> Invoked on the run thread only; implementations need not be thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HostFunction {
  /**
   * Applies the function to the current record.
   *
   * @param record record being processed; stages may let the function mutate it
   * @return result interpreted by the calling stage (truthiness for filters, a value for evaluators)
   */
  Object apply(Record record);

  /**
   * Best-effort human-readable description used for diagnostics only.
   *
   * @return description; defaults to the implementing class name
   */
  default String describe() {
    return getClass().getName();
  }

  /**
   * Wraps a function with an explicit description that the bridge renders as a comment.
   *
   * @param description diagnostic text, e.g. the source of the lambda
   * @param function delegate; must not be {@code null}
   * @return described host function; identity is the wrapper, not the delegate
   */
  static HostFunction named(String description, HostFunction function) {
    Objects.requireNonNull(function, "function");
    String text = description == null ? function.describe() : description;
    return new HostFunction() {
      @Override
      public Object apply(Record record) {
        return function.apply(record);
      }

      @Override
      public String describe() {
        return text;
      }
    };
  }
}
