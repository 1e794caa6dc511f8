package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.expression.RecordExpression;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.List;
import java.util.Set;

/**
 * {@code grep [-v] <expr>}: passes records whose expression is truthy, or falsy with {@code -v}.
 *
 * @since 0.1.0
 */
final class GrepStage extends AbstractStage {
  private final RecordExpression expression;
  private final boolean invert;

  GrepStage(String name, List<String> args, RecordReceiver downstream, StageContext context) {
    super(name, downstream, context);
    StageArguments parsed = StageArguments.parse(name, args, Set.of("-v"), Set.of());
    this.expression = compile(parsed.singleExpression());
    this.invert = parsed.has("-v");
  }

  @Override
  public boolean acceptRecord(Record record) {
    boolean matches = RecordExpression.isTruthy(evaluate(expression, record));
    if (matches != invert) {
      return pushRecord(record);
    }
    return true;
  }
}
