package ca.gc.cra.recstream.application.bridge;

import ca.gc.cra.recstream.application.expression.RecordExpression;
import ca.gc.cra.recstream.domain.function.HostFunction;
import ca.gc.cra.recstream.domain.function.RegistryToken;
import ca.gc.cra.recstream.domain.pipeline.StageArg;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns host closures supplied as stage arguments into textual arguments.
 * <p><strong>Why:</strong> Stages accept only text; the bridge parks the closure in a {@link HostFunctionRegistry}
 * and emits an expression that invokes it on the current record.</p>
 * <p><strong>Role:</strong> Application service called by the chain compiler before any record flows.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pass literal arguments through untouched.</li>
 *   <li>Register closures (deduplicated by identity) and emit {@code host('<token>', $r)}.</li>
 *   <li>Prefix the emitted text with a {@code #} comment describing the closure for diagnostics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Same as the underlying registry (single-threaded).</p>
 *
 * @since 0.1.0
 */
public final class HostFunctionBridge {
  private static final Logger log = LoggerFactory.getLogger(HostFunctionBridge.class);
  private static final int MAX_DESCRIPTION_LENGTH = 512;

  private final HostFunctionRegistry registry;

  /**
   * Creates a bridge over a registry.
   *
   * @param registry registry receiving bridged closures; must not be {@code null}
   */
  public HostFunctionBridge(HostFunctionRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Bridges one closure into a literal argument.
   *
   * @param function closure; must not be {@code null}
   * @return literal whose text invokes the closure on the current record
   * @throws RegistrationException if the registry refuses the closure
   */
  public StageArg.Literal bridge(HostFunction function) {
    RegistryToken token = registry.register(function);
    return new StageArg.Literal(comment(function) + RecordExpression.hostInvocation(token));
  }

  /**
   * Converts a stage argument list into the textual form a stage factory receives.
   *
   * @param args declared arguments
   * @return argument texts in the same order
   */
  public List<String> process(List<StageArg> args) {
    List<String> processed = new ArrayList<>(args.size());
    for (StageArg arg : args) {
      if (arg instanceof StageArg.HostFunctionArg hostArg) {
        processed.add(bridge(hostArg.function()).text());
      } else if (arg instanceof StageArg.Literal literal) {
        processed.add(literal.text());
      }
    }
    return processed;
  }

  private static String comment(HostFunction function) {
    String description;
    try {
      description = function.describe();
    } catch (RuntimeException ex) {
      log.debug("Host function {} failed to describe itself", function.getClass().getName(), ex);
      description = null;
    }
    if (description == null || description.isBlank()) {
      return "";
    }
    if (description.length() > MAX_DESCRIPTION_LENGTH) {
      description = description.substring(0, MAX_DESCRIPTION_LENGTH) + "...";
    }
    StringBuilder sb = new StringBuilder();
    for (String line : description.split("\\R")) {
      sb.append("# ").append(line.replaceAll("\\p{Cntrl}", " ")).append('\n');
    }
    return sb.toString();
  }

  /**
   * Returns the registry backing this bridge.
   *
   * @return registry
   */
  public HostFunctionRegistry registry() {
    return registry;
  }
}
