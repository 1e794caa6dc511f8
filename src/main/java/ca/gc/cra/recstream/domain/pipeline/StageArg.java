package ca.gc.cra.recstream.domain.pipeline;

import ca.gc.cra.recstream.domain.function.HostFunction;
import java.util.Objects;

/**
 * <strong>What:</strong> One argument of a stage call: either literal text or a host function.
 * <p><strong>Why:</strong> Stages only understand textual configuration; host functions are kept opaque until the
 * chain compiler bridges them into text.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface StageArg permits StageArg.Literal, StageArg.HostFunctionArg {

  /**
   * Creates a literal argument.
   *
   * @param text argument text; must not be {@code null}
   * @return literal argument
   */
  static StageArg literal(String text) {
    return new Literal(text);
  }

  /**
   * Creates a host-function argument.
   *
   * @param function closure; must not be {@code null}
   * @return host-function argument
   */
  static StageArg function(HostFunction function) {
    return new HostFunctionArg(function);
  }

  /**
   * Literal textual argument passed verbatim to the stage.
   *
   * @param text argument text
   */
  record Literal(String text) implements StageArg {
    public Literal {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /**
   * Host function awaiting bridging; equality is by closure identity.
   *
   * @param function closure
   */
  record HostFunctionArg(HostFunction function) implements StageArg {
    public HostFunctionArg {
      Objects.requireNonNull(function, "function");
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof HostFunctionArg that && that.function == function;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(function);
    }

    @Override
    public String toString() {
      return "<host function " + function.describe() + ">";
    }
  }
}
