package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.expression.RecordExpression;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code eval <expr>}: emits the expression value of each record as a line. {@code null} becomes an empty line;
 * records and maps are written as JSON.
 *
 * @since 0.1.0
 */
final class EvalStage extends AbstractStage {
  private final RecordExpression expression;

  EvalStage(String name, List<String> args, RecordReceiver downstream, StageContext context) {
    super(name, downstream, context);
    this.expression = compile(StageArguments.parse(name, args, Set.of(), Set.of()).singleExpression());
  }

  @Override
  public boolean acceptRecord(Record record) {
    return pushLine(render(evaluate(expression, record)));
  }

  private String render(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Record nested) {
      return context().codec().encode(nested);
    }
    if (value instanceof Map<?, ?> map) {
      return context().codec().encode(Values.toRecord(map));
    }
    return String.valueOf(value);
  }
}
