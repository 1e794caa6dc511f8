/**
 * Configuration loading (defaults, YAML, CLI overrides), pipeline definition files, and the composition root
 * that wires the engine for the command line.
 *
 * @since 0.1.0
 */
package ca.gc.cra.recstream.config;
