/**
 * <strong>Purpose:</strong> Ports defining the stage, downstream, catalog, and metrics contracts of the engine.
 * <p><strong>Pipeline role:</strong> Domain layer; stage catalogs, sinks, and metrics adapters implement these
 * interfaces.</p>
 * <p><strong>Concurrency:</strong> Chains are single-threaded; a stage and its context never leave the run thread.</p>
 * <p><strong>Performance:</strong> Push-based contracts with no intermediate buffering.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.application.port;
