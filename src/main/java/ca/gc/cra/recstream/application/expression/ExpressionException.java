package ca.gc.cra.recstream.application.expression;

import ca.gc.cra.recstream.application.pipeline.PipelineException;

/**
 * Raised when a record expression cannot be compiled or evaluated.
 *
 * @since 0.1.0
 */
public final class ExpressionException extends PipelineException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the failure
   */
  public ExpressionException(String message) {
    super(message);
  }

  /**
   * Creates the exception with a cause.
   *
   * @param message description of the failure
   * @param cause underlying failure
   */
  public ExpressionException(String message, Throwable cause) {
    super(message, cause);
  }
}
