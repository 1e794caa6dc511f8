package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.expression.RecordExpression;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.List;
import java.util.Set;

/**
 * {@code xform <expr>}: evaluates the expression for its effect on the record (typically a host function that
 * rewrites fields in place), then passes the record on.
 *
 * @since 0.1.0
 */
final class XformStage extends AbstractStage {
  private final RecordExpression expression;

  XformStage(String name, List<String> args, RecordReceiver downstream, StageContext context) {
    super(name, downstream, context);
    this.expression = compile(StageArguments.parse(name, args, Set.of(), Set.of()).singleExpression());
  }

  @Override
  public boolean acceptRecord(Record record) {
    evaluate(expression, record);
    return pushRecord(record);
  }
}
