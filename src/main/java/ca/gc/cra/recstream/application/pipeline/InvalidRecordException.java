package ca.gc.cra.recstream.application.pipeline;

/**
 * Raised when a line that a stage needs as a record cannot be read as a JSON object. The message carries the
 * {@code source:line} position of the offending input.
 *
 * @since 0.1.0
 */
public final class InvalidRecordException extends PipelineException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param stageName stage that received the line
   * @param position {@code source:line} of the input unit
   * @param cause parse failure
   */
  public InvalidRecordException(String stageName, String position, Throwable cause) {
    super(stageName + " at " + position + ": " + cause.getMessage(), cause);
  }
}
