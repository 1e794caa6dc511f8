package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.expression.ExpressionException;
import ca.gc.cra.recstream.application.expression.RecordExpression;
import ca.gc.cra.recstream.application.pipeline.InvalidRecordException;
import ca.gc.cra.recstream.application.pipeline.PipelineException;
import ca.gc.cra.recstream.application.pipeline.StageConfigurationException;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.Stage;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.Objects;

/**
 * <strong>What:</strong> Base class for the builtin stages.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold the stage name, downstream receiver, and run context.</li>
 *   <li>Decode lines into records for stages that operate on records.</li>
 *   <li>Attribute expression and host-function failures to the current {@code source:line}.</li>
 *   <li>Run {@link #onFinish()} and then finish downstream, once.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances belong to one run thread.</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractStage implements Stage {
  private final String name;
  private final RecordReceiver downstream;
  private final StageContext context;
  private boolean finished;

  /**
   * Creates the base state.
   *
   * @param name stage name used in error messages
   * @param downstream receiver of this stage's output
   * @param context run context
   */
  protected AbstractStage(String name, RecordReceiver downstream, StageContext context) {
    this.name = Objects.requireNonNull(name, "name");
    this.downstream = Objects.requireNonNull(downstream, "downstream");
    this.context = Objects.requireNonNull(context, "context");
  }

  @Override
  public boolean wantsInput() {
    return true;
  }

  /**
   * Decodes the line as a JSON object and hands it to {@link #acceptRecord(Record)}.
   *
   * @throws InvalidRecordException if the line is not a JSON object
   */
  @Override
  public boolean acceptLine(String line) {
    return acceptRecord(decode(line));
  }

  @Override
  public final void finish() {
    if (finished) {
      return;
    }
    finished = true;
    onFinish();
    downstream.finish();
  }

  /**
   * Emits buffered output before downstream is finished. Default does nothing.
   */
  protected void onFinish() {}

  protected final boolean pushRecord(Record record) {
    return downstream.acceptRecord(record);
  }

  protected final boolean pushLine(String line) {
    return downstream.acceptLine(line);
  }

  protected final Record decode(String line) {
    try {
      return context.codec().decode(line);
    } catch (IllegalArgumentException ex) {
      throw new InvalidRecordException(name, context.position(), ex);
    }
  }

  /**
   * Evaluates an expression, attributing failures to the current input position.
   *
   * @param expression compiled expression
   * @param record current record
   * @return expression value
   * @throws ExpressionException on evaluation or host-function failure
   */
  protected final Object evaluate(RecordExpression expression, Record record) {
    try {
      return expression.evaluate(record, context.functions());
    } catch (PipelineException ex) {
      throw new ExpressionException(name + " at " + context.position() + ": " + ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      throw new ExpressionException(
          name + " at " + context.position() + ": host function failed: " + ex, ex);
    }
  }

  protected final RecordExpression compile(String text) {
    try {
      return RecordExpression.compile(text);
    } catch (ExpressionException ex) {
      throw new StageConfigurationException(name, ex.getMessage(), ex);
    }
  }

  protected final String name() {
    return name;
  }

  protected final StageContext context() {
    return context;
  }
}
