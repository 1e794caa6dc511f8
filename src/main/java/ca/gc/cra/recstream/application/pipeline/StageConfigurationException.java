package ca.gc.cra.recstream.application.pipeline;

/**
 * Raised by a stage factory when the textual arguments of a stage call are invalid.
 *
 * @since 0.1.0
 */
public final class StageConfigurationException extends PipelineException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param stageName stage whose arguments were rejected
   * @param message description of the problem
   */
  public StageConfigurationException(String stageName, String message) {
    super(stageName + ": " + message);
  }

  /**
   * Creates the exception with a cause.
   *
   * @param stageName stage whose arguments were rejected
   * @param message description of the problem
   * @param cause underlying failure
   */
  public StageConfigurationException(String stageName, String message, Throwable cause) {
    super(stageName + ": " + message, cause);
  }
}
