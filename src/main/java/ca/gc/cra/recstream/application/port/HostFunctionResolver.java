package ca.gc.cra.recstream.application.port;

import ca.gc.cra.recstream.domain.function.HostFunction;
import ca.gc.cra.recstream.domain.function.RegistryToken;
import java.util.Optional;

/**
 * Read side of the host-function registry used by stage expression evaluators.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HostFunctionResolver {
  /**
   * Looks up a registered host function.
   *
   * @param token registry token embedded in a stage argument
   * @return registered function, or empty when the token is unknown
   */
  Optional<HostFunction> resolve(RegistryToken token);

  /** Resolver that knows no functions. */
  HostFunctionResolver NONE = token -> Optional.empty();
}
