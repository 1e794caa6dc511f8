package ca.gc.cra.recstream.application.port;

import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Resolves stage identifiers to factories.
 * <p><strong>Why:</strong> Stage names are bound late; how the set of names is discovered is the catalog's concern,
 * the engine only asks yes/no plus a factory.</p>
 * <p><strong>Role:</strong> Domain port implemented by stage catalogs.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be immutable after construction.</p>
 *
 * @since 0.1.0
 */
public interface StageCatalog {
  /**
   * Resolves a stage name.
   *
   * @param name stage identifier as written by the caller
   * @return factory, or empty when the name is unknown
   */
  Optional<StageFactory> resolve(String name);

  /**
   * Lists the names this catalog can resolve, for help output.
   *
   * @return canonical stage names
   */
  Set<String> names();
}
