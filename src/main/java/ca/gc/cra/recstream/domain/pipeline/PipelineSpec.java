package ca.gc.cra.recstream.domain.pipeline;

import ca.gc.cra.recstream.domain.function.HostFunction;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable, ordered list of stage calls built with chained method calls.
 * <p><strong>Why:</strong> Callers declare a pipeline once and reuse, branch, or compose it; every builder
 * operation returns a new value so partially built pipelines can be shared safely.</p>
 * <p><strong>Role:</strong> Domain input to the chain compiler and pipeline runner.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append stage calls in execution order.</li>
 *   <li>Concatenate pipelines associatively (receiver first).</li>
 *   <li>Defer every stage-name and argument check to compilation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable and safe to share between threads.</p>
 * <p><strong>Performance:</strong> Each operation copies the call list; pipelines are short.</p>
 *
 * <pre>{@code
 * PipelineSpec spec = PipelineSpec.empty()
 *     .call("fromjson")
 *     .call("grep", (HostFunction) r -> ((Number) r.get("age")).intValue() >= 21)
 *     .call("sort", "--key", "income=-numeric")
 *     .call("totable");
 * }</pre>
 *
 * @since 0.1.0
 */
public final class PipelineSpec {
  private static final PipelineSpec EMPTY = new PipelineSpec(List.of());

  private final List<StageCall> stages;

  private PipelineSpec(List<StageCall> stages) {
    this.stages = stages;
  }

  /**
   * Returns a pipeline with no stages.
   *
   * @return empty pipeline
   */
  public static PipelineSpec empty() {
    return EMPTY;
  }

  /**
   * Returns a pipeline running the supplied calls in order.
   *
   * @param calls stage calls; must not be {@code null}
   * @return pipeline
   */
  public static PipelineSpec of(List<StageCall> calls) {
    return calls.isEmpty() ? EMPTY : new PipelineSpec(List.copyOf(calls));
  }

  /**
   * Appends a stage call after all existing stages.
   *
   * @param name stage identifier; resolved only when the pipeline runs
   * @param args ordered arguments: {@link StageArg}s, {@link String} literals or {@link HostFunction}s
   * @return new pipeline
   * @throws IllegalArgumentException if an element is none of the accepted argument types
   */
  public PipelineSpec call(String name, List<?> args) {
    Objects.requireNonNull(args, "args");
    List<StageArg> converted = new ArrayList<>(args.size());
    for (Object arg : args) {
      converted.add(toArg(name, arg));
    }
    List<StageCall> next = new ArrayList<>(stages.size() + 1);
    next.addAll(stages);
    next.add(new StageCall(name, converted));
    return new PipelineSpec(List.copyOf(next));
  }

  /**
   * Appends a stage call whose arguments are {@link String} literals and/or {@link HostFunction}s.
   *
   * @param name stage identifier
   * @param args literal strings or host functions
   * @return new pipeline
   * @throws IllegalArgumentException if an argument is neither a string nor a host function
   */
  public PipelineSpec call(String name, Object... args) {
    List<StageArg> converted = new ArrayList<>(args == null ? 0 : args.length);
    if (args != null) {
      for (Object arg : args) {
        converted.add(toArg(name, arg));
      }
    }
    return call(name, converted);
  }

  /**
   * Returns a pipeline whose stages are this pipeline's followed by {@code other}'s.
   *
   * @param other pipeline to run after this one; must not be {@code null}
   * @return new pipeline
   */
  public PipelineSpec concat(PipelineSpec other) {
    Objects.requireNonNull(other, "other");
    if (other.stages.isEmpty()) {
      return this;
    }
    if (stages.isEmpty()) {
      return other;
    }
    List<StageCall> next = new ArrayList<>(stages.size() + other.stages.size());
    next.addAll(stages);
    next.addAll(other.stages);
    return new PipelineSpec(List.copyOf(next));
  }

  /**
   * Alias of {@link #concat(PipelineSpec)}: {@code other} runs after this pipeline.
   *
   * @param other following pipeline
   * @return new pipeline
   */
  public PipelineSpec then(PipelineSpec other) {
    return concat(other);
  }

  /**
   * Returns the stage calls in execution order.
   *
   * @return immutable list
   */
  public List<StageCall> stages() {
    return stages;
  }

  /**
   * Returns the name of the last appended stage, which drives the result-materialization policy.
   *
   * @return last stage name, empty for an empty pipeline
   */
  public Optional<String> lastStageName() {
    return stages.isEmpty() ? Optional.empty() : Optional.of(stages.get(stages.size() - 1).name());
  }

  /**
   * Number of stages.
   *
   * @return stage count
   */
  public int size() {
    return stages.size();
  }

  /**
   * Indicates whether the pipeline has no stages.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return stages.isEmpty();
  }

  private static StageArg toArg(String stage, Object arg) {
    if (arg instanceof StageArg stageArg) {
      return stageArg;
    }
    if (arg instanceof HostFunction function) {
      return StageArg.function(function);
    }
    if (arg instanceof CharSequence text) {
      return StageArg.literal(text.toString());
    }
    throw new IllegalArgumentException("argument for stage " + stage
        + " must be a String or HostFunction (was " + (arg == null ? "null" : arg.getClass().getName()) + ")");
  }

  @Override
  public boolean equals(Object other) {
    return this == other || (other instanceof PipelineSpec that && stages.equals(that.stages));
  }

  @Override
  public int hashCode() {
    return stages.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("PipelineSpec[");
    for (int i = 0; i < stages.size(); i++) {
      if (i > 0) {
        sb.append(" | ");
      }
      sb.append(stages.get(i));
    }
    return sb.append(']').toString();
  }
}
