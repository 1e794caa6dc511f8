package ca.gc.cra.recstream.application.pipeline;

/**
 * Base type for fatal pipeline failures. A pipeline run is a batch call: failures abort the run and are never
 * downgraded or retried internally.
 *
 * @since 0.1.0
 */
public class PipelineException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message description of the failure
   */
  public PipelineException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message description of the failure
   * @param cause underlying failure
   */
  public PipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
