package ca.gc.cra.recstream.application.bridge;

import ca.gc.cra.recstream.application.pipeline.PipelineException;

/**
 * Raised when a host function cannot be registered. Bridging happens while the chain is compiled, so this is a
 * construction-time failure: no record has flowed yet.
 *
 * @since 0.1.0
 */
public final class RegistrationException extends PipelineException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the failure
   */
  public RegistrationException(String message) {
    super(message);
  }
}
