package ca.gc.cra.recstream.application.pipeline;

import ca.gc.cra.recstream.application.bridge.HostFunctionBridge;
import ca.gc.cra.recstream.application.bridge.HostFunctionRegistry;
import ca.gc.cra.recstream.application.port.MetricsPort;
import ca.gc.cra.recstream.application.port.RecordCodec;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageCatalog;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.application.sink.LineWritingSink;
import ca.gc.cra.recstream.application.sink.RecordCollectingSink;
import ca.gc.cra.recstream.domain.pipeline.PipelineSpec;
import ca.gc.cra.recstream.domain.pipeline.StageCall;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Compiles a {@link PipelineSpec}, drives input through it, and shapes the result.
 * <p><strong>Why:</strong> Single entry point for embedders and the CLI; owns the host-function registry that
 * closures passed as stage arguments are parked in.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the sink: the caller's writer, an in-memory text buffer, or a record collector.</li>
 *   <li>Compile the chain tail first and push input into it until exhausted or told to stop.</li>
 *   <li>Finish the chain exactly once and release the in-memory buffer on every exit path.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; use one runner per thread or synchronize around
 * {@code run}.</p>
 * <p><strong>Observability:</strong> Increments {@code pipeline.run.started}, {@code pipeline.run.completed},
 * {@code pipeline.run.failed}, {@code pipeline.run.stoppedEarly}; observes {@code pipeline.input.units} and
 * {@code pipeline.run.latencyNanos}. Sets MDC key {@code pipeline} while a run is active.</p>
 *
 * @since 0.1.0
 */
public final class PipelineRunner implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);
  private static final String MDC_KEY = "pipeline";

  private final ChainCompiler compiler;
  private final HostFunctionRegistry registry;
  private final RecordCodec codec;
  private final OutputPolicy outputPolicy;
  private final MetricsPort metrics;
  private final InputDriver driver = new InputDriver();

  /**
   * Creates a runner with the default output policy, a fresh registry, and no metrics.
   *
   * @param catalog stage lookup
   * @param codec line/record conversion
   */
  public PipelineRunner(StageCatalog catalog, RecordCodec codec) {
    this(catalog, codec, OutputPolicy.DEFAULT, new HostFunctionRegistry(), MetricsPort.NO_OP);
  }

  /**
   * Creates a runner.
   *
   * @param catalog stage lookup; must not be {@code null}
   * @param codec line/record conversion; must not be {@code null}
   * @param outputPolicy decides text versus records when no writer is given; must not be {@code null}
   * @param registry registry owned by this runner and closed with it; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public PipelineRunner(
      StageCatalog catalog,
      RecordCodec codec,
      OutputPolicy outputPolicy,
      HostFunctionRegistry registry,
      MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.compiler = new ChainCompiler(catalog, new HostFunctionBridge(registry));
    this.codec = Objects.requireNonNull(codec, "codec");
    this.outputPolicy = Objects.requireNonNull(outputPolicy, "outputPolicy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs a pipeline whose head stage generates its own input.
   *
   * @param spec pipeline
   * @return text or records, per the output policy
   * @throws IOException if reading input or writing output fails
   * @throws InputRequiredException if the head stage needs input
   */
  public PipelineResult run(PipelineSpec spec) throws IOException {
    return run(spec, null, null);
  }

  /**
   * Runs a pipeline over input, collecting output in memory.
   *
   * @param spec pipeline
   * @param input input, or {@code null} when the head generates its own
   * @return text or records, per the output policy
   * @throws IOException if reading input fails
   */
  public PipelineResult run(PipelineSpec spec, PipelineInput input) throws IOException {
    return run(spec, input, null);
  }

  /**
   * Runs a pipeline.
   *
   * @param spec pipeline; must not be {@code null}
   * @param input input, or {@code null} when the head generates its own
   * @param output destination writer, or {@code null} to collect in memory; flushed but never closed
   * @return {@link PipelineResult.Streamed} when {@code output} is given; otherwise {@link PipelineResult.Text} if
   *     the last stage produces text, else {@link PipelineResult.Records}
   * @throws IOException if reading input or writing output fails
   * @throws UnknownStageException if a stage name does not resolve
   * @throws InputRequiredException if the head stage needs input and none was given
   * @throws PipelineException for stage configuration, expression, or registration failures
   */
  public PipelineResult run(PipelineSpec spec, PipelineInput input, Writer output) throws IOException {
    Objects.requireNonNull(spec, "spec");
    metrics.increment("pipeline.run.started");
    long started = System.nanoTime();
    String previous = MDC.get(MDC_KEY);
    MDC.put(MDC_KEY, stageNames(spec));
    try {
      PipelineResult result;
      if (output != null) {
        execute(spec, input, new LineWritingSink(output, codec));
        result = new PipelineResult.Streamed(output);
      } else if (spec.lastStageName().filter(outputPolicy::isTextProducingStage).isPresent()) {
        StringWriter buffer = new StringWriter();
        try (Writer writer = new BufferedWriter(buffer)) {
          execute(spec, input, new LineWritingSink(writer, codec));
        }
        result = new PipelineResult.Text(buffer.toString());
      } else {
        RecordCollectingSink sink = new RecordCollectingSink(codec);
        execute(spec, input, sink);
        result = new PipelineResult.Records(sink.records());
      }
      metrics.increment("pipeline.run.completed");
      return result;
    } catch (IOException | RuntimeException ex) {
      metrics.increment("pipeline.run.failed");
      log.debug("Pipeline [{}] failed: {}", stageNames(spec), ex.getMessage());
      throw ex;
    } finally {
      metrics.observe("pipeline.run.latencyNanos", System.nanoTime() - started);
      if (previous == null) {
        MDC.remove(MDC_KEY);
      } else {
        MDC.put(MDC_KEY, previous);
      }
    }
  }

  /**
   * Runs a pipeline into a caller-supplied sink and returns that sink.
   *
   * @param spec pipeline
   * @param input input, or {@code null} when the head generates its own
   * @param sink terminal receiver
   * @param <S> sink type
   * @return {@code sink}, after the chain finished
   * @throws IOException if reading input fails
   */
  public <S extends RecordReceiver> S runInto(PipelineSpec spec, PipelineInput input, S sink) throws IOException {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(sink, "sink");
    execute(spec, input, sink);
    return sink;
  }

  private void execute(PipelineSpec spec, PipelineInput input, RecordReceiver sink) throws IOException {
    StageContext context = new StageContext(registry, codec);
    Chain chain = compiler.compile(spec, sink, context);
    try {
      InputDriver.Outcome outcome = driver.drive(chain, input, context);
      metrics.observe("pipeline.input.units", outcome.units());
      if (outcome.stoppedEarly()) {
        metrics.increment("pipeline.run.stoppedEarly");
        log.debug("Pipeline {} stopped early after {} units", chain.stageNames(), outcome.units());
      }
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
  }

  private static String stageNames(PipelineSpec spec) {
    return spec.stages().stream().map(StageCall::name).collect(Collectors.joining(" | "));
  }

  /**
   * Returns the host-function registry owned by this runner.
   *
   * @return registry
   */
  public HostFunctionRegistry registry() {
    return registry;
  }

  /**
   * Closes the registry; later runs that bridge closures fail with a registration error.
   */
  @Override
  public void close() {
    registry.close();
  }
}
