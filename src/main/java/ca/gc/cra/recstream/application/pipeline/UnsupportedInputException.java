package ca.gc.cra.recstream.application.pipeline;

/**
 * Raised when an untyped input value matches none of the accepted shapes (line stream, lines, records).
 *
 * @since 0.1.0
 */
public final class UnsupportedInputException extends PipelineException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param description rendering of the rejected value, already truncated by the caller
   */
  public UnsupportedInputException(String description) {
    super("Unknown input: " + description);
  }
}
