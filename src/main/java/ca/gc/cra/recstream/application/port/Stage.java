package ca.gc.cra.recstream.application.port;

/**
 * <strong>What:</strong> Capability every stage implementation must satisfy to take part in a chain.
 * <p><strong>Why:</strong> The engine depends only on this contract; concrete filters, sorters, and formatters live
 * behind {@link StageFactory} implementations.</p>
 * <p><strong>Role:</strong> Domain port implemented by stage adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Declare whether the stage consumes pushed input or generates its own.</li>
 *   <li>Transform pushed lines/records and push results to the downstream supplied at construction.</li>
 *   <li>Flush buffered output and propagate {@link #finish()} downstream exactly once.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are created per run and used by one thread; they may hold mutable
 * buffering state.</p>
 * <p><strong>Performance:</strong> Stages push eagerly; call depth equals chain length.</p>
 *
 * @since 0.1.0
 */
public interface Stage extends RecordReceiver {
  /**
   * Indicates whether this stage expects pushed input.
   *
   * @return {@code false} for self-generating source stages
   */
  boolean wantsInput();

  /**
   * Called once at end of input or after an early stop; flushes buffered output and finishes downstream.
   */
  @Override
  void finish();
}
