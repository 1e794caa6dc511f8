package ca.gc.cra.recstream.application.pipeline;

/**
 * Raised when the head stage wants pushed input but the run supplied none.
 *
 * @since 0.1.0
 */
public final class InputRequiredException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final String stageName;

  /**
   * Creates the exception.
   *
   * @param stageName head stage name
   */
  public InputRequiredException(String stageName) {
    super("Input required for " + stageName);
    this.stageName = stageName;
  }

  /**
   * Returns the head stage that required input.
   *
   * @return stage name
   */
  public String stageName() {
    return stageName;
  }
}
