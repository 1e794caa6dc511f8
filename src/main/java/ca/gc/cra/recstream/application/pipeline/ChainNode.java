package ca.gc.cra.recstream.application.pipeline;

import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.Stage;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.Objects;

/**
 * <strong>What:</strong> One compiled link of a chain: a stage instance plus the receiver it pushes to.
 * <p><strong>Why:</strong> Keeps the stage name next to the instance for diagnostics and lets callers walk to the
 * terminal sink of a compiled chain.</p>
 * <p><strong>Thread-safety:</strong> Confined to the run thread.</p>
 *
 * @since 0.1.0
 */
public final class ChainNode implements RecordReceiver {
  private final String stageName;
  private final Stage stage;
  private final RecordReceiver downstream;

  ChainNode(String stageName, Stage stage, RecordReceiver downstream) {
    this.stageName = Objects.requireNonNull(stageName, "stageName");
    this.stage = Objects.requireNonNull(stage, "stage");
    this.downstream = Objects.requireNonNull(downstream, "downstream");
  }

  /**
   * Name the stage was resolved under.
   *
   * @return stage name
   */
  public String stageName() {
    return stageName;
  }

  /**
   * Stage instance created for this link.
   *
   * @return stage
   */
  public Stage stage() {
    return stage;
  }

  /**
   * Receiver this link pushes to: the next node or the sink.
   *
   * @return downstream receiver
   */
  public RecordReceiver downstream() {
    return downstream;
  }

  /**
   * Walks downstream links until the first receiver that is not a chain node.
   *
   * @return terminal sink of the chain
   */
  public RecordReceiver outputSink() {
    RecordReceiver current = downstream;
    while (current instanceof ChainNode node) {
      current = node.downstream;
    }
    return current;
  }

  /**
   * Indicates whether the stage consumes pushed input.
   *
   * @return see {@link Stage#wantsInput()}
   */
  public boolean wantsInput() {
    return stage.wantsInput();
  }

  @Override
  public boolean acceptLine(String line) {
    return stage.acceptLine(line);
  }

  @Override
  public boolean acceptRecord(Record record) {
    return stage.acceptRecord(record);
  }

  @Override
  public void finish() {
    stage.finish();
  }

  @Override
  public String toString() {
    return "ChainNode[" + stageName + "]";
  }
}
