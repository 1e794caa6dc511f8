package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.List;
import java.util.Set;

/**
 * {@code tojson}: writes each record as one line of JSON.
 *
 * @since 0.1.0
 */
final class ToJsonStage extends AbstractStage {
  ToJsonStage(String name, List<String> args, RecordReceiver downstream, StageContext context) {
    super(name, downstream, context);
    StageArguments.parse(name, args, Set.of(), Set.of()).requireNoPositional();
  }

  @Override
  public boolean acceptRecord(Record record) {
    return pushLine(context().codec().encode(record));
  }
}
