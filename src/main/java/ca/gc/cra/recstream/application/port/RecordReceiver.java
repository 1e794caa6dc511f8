package ca.gc.cra.recstream.application.port;

import ca.gc.cra.recstream.domain.record.Record;

/**
 * <strong>What:</strong> Consumption contract shared by stages, chain nodes, and sinks.
 * <p><strong>Why:</strong> Every link in a chain pushes to "whatever is next" through the same operations, so a sink
 * can terminate a chain anywhere a stage could appear.</p>
 * <p><strong>Role:</strong> Domain port on the downstream side of every stage.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept one line of text or one record at a time.</li>
 *   <li>Report whether upstream should keep pushing via the boolean return value.</li>
 *   <li>Receive the end-of-input notification exactly once.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single-threaded; calls arrive synchronously from the upstream link.</p>
 * <p><strong>Performance:</strong> Hot path; one call per unit per link, no queueing.</p>
 *
 * @since 0.1.0
 * @see Stage
 */
public interface RecordReceiver {
  /**
   * Consumes one line of text.
   *
   * @param line line without its terminator; never {@code null}
   * @return {@code false} to ask upstream to stop pushing further input
   * @throws java.io.UncheckedIOException if a sink cannot write the line
   */
  boolean acceptLine(String line);

  /**
   * Consumes one record.
   *
   * @param record record; never {@code null}
   * @return {@code false} to ask upstream to stop pushing further input
   */
  boolean acceptRecord(Record record);

  /**
   * Signals end of input. Stages flush buffered output downstream and then propagate the call; sinks usually
   * have nothing to do.
   */
  default void finish() {}
}
