package ca.gc.cra.recstream.domain.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Declarative call of a named stage with its arguments.
 * <p><strong>Why:</strong> Names are resolved late, at chain compilation, so a call can be declared before the
 * stage catalog is known.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the argument list is copied.</p>
 *
 * @param name stage identifier, unvalidated until compilation
 * @param args ordered arguments
 * @since 0.1.0
 */
public record StageCall(String name, List<StageArg> args) {
  /**
   * Copies the argument list.
   *
   * @throws NullPointerException if {@code name}, {@code args}, or any argument is {@code null}
   */
  public StageCall {
    Objects.requireNonNull(name, "name");
    args = List.copyOf(Objects.requireNonNull(args, "args"));
  }

  @Override
  public String toString() {
    return args.isEmpty() ? name : name + " " + args;
  }
}
