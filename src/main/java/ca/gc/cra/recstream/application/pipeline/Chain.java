package ca.gc.cra.recstream.application.pipeline;

import ca.gc.cra.recstream.application.port.RecordReceiver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> A compiled, ready-to-drive chain of stage instances ending in a sink.
 * <p><strong>Why:</strong> Separates compilation (resolving names, bridging arguments) from driving input, so the
 * driver only sees an entry receiver and a finish call.</p>
 * <p><strong>Thread-safety:</strong> Single use on one thread.</p>
 *
 * @since 0.1.0
 */
public final class Chain {
  private final ChainNode head;
  private final RecordReceiver sink;

  Chain(ChainNode head, RecordReceiver sink) {
    this.head = head;
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /**
   * First stage of the chain, absent for an empty pipeline.
   *
   * @return head node
   */
  public Optional<ChainNode> head() {
    return Optional.ofNullable(head);
  }

  /**
   * Receiver that input is pushed into: the head stage, or the sink when the pipeline is empty.
   *
   * @return entry receiver
   */
  public RecordReceiver entry() {
    return head != null ? head : sink;
  }

  /**
   * Terminal sink of the chain.
   *
   * @return sink
   */
  public RecordReceiver sink() {
    return sink;
  }

  /**
   * Indicates whether the head consumes pushed input. An empty pipeline passes input straight to the sink.
   *
   * @return {@code true} when input should be driven into {@link #entry()}
   */
  public boolean wantsInput() {
    return head == null || head.wantsInput();
  }

  /**
   * Lists the stage names from head to tail.
   *
   * @return stage names
   */
  public List<String> stageNames() {
    List<String> names = new ArrayList<>();
    RecordReceiver current = head;
    while (current instanceof ChainNode node) {
      names.add(node.stageName());
      current = node.downstream();
    }
    return Collections.unmodifiableList(names);
  }

  /**
   * Finishes the head; each stage propagates the call downstream. An empty chain finishes the sink directly.
   */
  public void finish() {
    entry().finish();
  }
}
