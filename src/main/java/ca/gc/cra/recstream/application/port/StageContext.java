package ca.gc.cra.recstream.application.port;

import java.util.Objects;

/**
 * <strong>What:</strong> Per-run context shared by all stages of one chain.
 * <p><strong>Why:</strong> Stages need to call host functions bridged into their arguments and to attribute errors
 * to the input line being processed.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the host-function resolver of the runner that compiled the chain.</li>
 *   <li>Expose the record codec used at line/record boundaries.</li>
 *   <li>Track the current source name and 1-based line number as the driving loop advances.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mutable and confined to the run thread.</p>
 *
 * @since 0.1.0
 */
public final class StageContext {
  /** Label used when no input source is active. */
  public static final String NO_SOURCE = "-";

  private final HostFunctionResolver functions;
  private final RecordCodec codec;
  private String sourceName = NO_SOURCE;
  private long lineNumber;

  /**
   * Creates a context.
   *
   * @param functions resolver for bridged host functions; must not be {@code null}
   * @param codec line/record conversion; must not be {@code null}
   */
  public StageContext(HostFunctionResolver functions, RecordCodec codec) {
    this.functions = Objects.requireNonNull(functions, "functions");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * Returns the host-function resolver.
   *
   * @return resolver
   */
  public HostFunctionResolver functions() {
    return functions;
  }

  /**
   * Returns the codec stages use to turn lines into records and back.
   *
   * @return codec
   */
  public RecordCodec codec() {
    return codec;
  }

  /**
   * Switches attribution to a new source and resets the line counter.
   *
   * @param name source label such as {@code stdin} or a file path
   */
  public void beginSource(String name) {
    this.sourceName = name == null || name.isBlank() ? NO_SOURCE : name;
    this.lineNumber = 0;
  }

  /**
   * Advances the line counter for the current source.
   */
  public void nextUnit() {
    lineNumber++;
  }

  /**
   * Returns the current source label.
   *
   * @return source name
   */
  public String sourceName() {
    return sourceName;
  }

  /**
   * Returns the 1-based number of the unit being processed, or 0 before the first.
   *
   * @return line number
   */
  public long lineNumber() {
    return lineNumber;
  }

  /**
   * Renders the current position as {@code source:line} for error messages.
   *
   * @return position text
   */
  public String position() {
    return sourceName + ":" + lineNumber;
  }
}
