package ca.gc.cra.recstream.api;

/**
 * <strong>What:</strong> Exit codes returned by the {@code recstream} command line.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading input or writing output failed. */
  IO_ERROR(3),
  /** The pipeline definition or configuration was rejected (unknown stage, bad stage arguments). */
  CONFIG_ERROR(4),
  /** The pipeline failed while records were flowing. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
