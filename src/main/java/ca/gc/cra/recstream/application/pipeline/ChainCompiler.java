package ca.gc.cra.recstream.application.pipeline;

import ca.gc.cra.recstream.application.bridge.HostFunctionBridge;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.Stage;
import ca.gc.cra.recstream.application.port.StageCatalog;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.application.port.StageFactory;
import ca.gc.cra.recstream.domain.pipeline.PipelineSpec;
import ca.gc.cra.recstream.domain.pipeline.StageCall;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds a {@link Chain} from a {@link PipelineSpec}, tail first.
 * <p><strong>Why:</strong> Each stage is constructed with its downstream receiver, so the last stage has to exist
 * before the one in front of it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve each stage name through the {@link StageCatalog}.</li>
 *   <li>Rewrite host-function arguments into text through the {@link HostFunctionBridge}.</li>
 *   <li>Link each stage to the receiver built for the call after it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the bridge, which is single-threaded.</p>
 *
 * @since 0.1.0
 */
public final class ChainCompiler {
  private static final Logger log = LoggerFactory.getLogger(ChainCompiler.class);

  private final StageCatalog catalog;
  private final HostFunctionBridge bridge;

  /**
   * Creates a compiler.
   *
   * @param catalog stage lookup; must not be {@code null}
   * @param bridge host-function bridge; must not be {@code null}
   */
  public ChainCompiler(StageCatalog catalog, HostFunctionBridge bridge) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.bridge = Objects.requireNonNull(bridge, "bridge");
  }

  /**
   * Compiles a pipeline against a sink.
   *
   * @param spec pipeline to compile
   * @param sink terminal receiver
   * @param context per-run context handed to every stage
   * @return compiled chain; its head is absent when {@code spec} is empty
   * @throws UnknownStageException if a stage name does not resolve
   * @throws StageConfigurationException if a stage rejects its arguments
   * @throws ca.gc.cra.recstream.application.bridge.RegistrationException if a host function cannot be registered
   */
  public Chain compile(PipelineSpec spec, RecordReceiver sink, StageContext context) {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(context, "context");
    List<StageCall> calls = spec.stages();
    RecordReceiver downstream = sink;
    ChainNode head = null;
    for (int i = calls.size() - 1; i >= 0; i--) {
      StageCall call = calls.get(i);
      StageFactory factory = catalog.resolve(call.name())
          .orElseThrow(() -> new UnknownStageException(call.name()));
      List<String> args = bridge.process(call.args());
      Stage stage = factory.create(args, downstream, context);
      if (stage == null) {
        throw new StageConfigurationException(call.name(), "factory returned no stage");
      }
      head = new ChainNode(call.name(), stage, downstream);
      downstream = head;
    }
    Chain chain = new Chain(head, sink);
    if (log.isDebugEnabled()) {
      log.debug("Compiled chain {} -> {}", chain.stageNames(), sink.getClass().getSimpleName());
    }
    return chain;
  }
}
