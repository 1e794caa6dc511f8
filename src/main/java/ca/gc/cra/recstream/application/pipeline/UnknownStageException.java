package ca.gc.cra.recstream.application.pipeline;

/**
 * Raised during chain compilation when a stage name cannot be resolved by the catalog.
 *
 * @since 0.1.0
 */
public final class UnknownStageException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final String stageName;

  /**
   * Creates the exception.
   *
   * @param stageName unresolved name as written by the caller
   */
  public UnknownStageException(String stageName) {
    super("Unknown stage: " + stageName);
    this.stageName = stageName;
  }

  /**
   * Returns the unresolved stage name.
   *
   * @return stage name
   */
  public String stageName() {
    return stageName;
  }
}
