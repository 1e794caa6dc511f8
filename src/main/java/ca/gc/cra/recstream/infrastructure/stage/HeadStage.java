package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.List;
import java.util.Set;

/**
 * {@code head [-n N]}: passes the first N units (default 10) and then asks upstream to stop. Lines pass through
 * as lines.
 *
 * @since 0.1.0
 */
final class HeadStage extends AbstractStage {
  static final int DEFAULT_LIMIT = 10;

  private final int limit;
  private int seen;

  HeadStage(String name, List<String> args, RecordReceiver downstream, StageContext context) {
    super(name, downstream, context);
    StageArguments parsed = StageArguments.parse(name, args, Set.of(), Set.of("-n"));
    parsed.requireNoPositional();
    this.limit = parsed.nonNegativeInt("-n", DEFAULT_LIMIT);
  }

  @Override
  public boolean acceptLine(String line) {
    if (seen >= limit) {
      return false;
    }
    seen++;
    return pushLine(line) && seen < limit;
  }

  @Override
  public boolean acceptRecord(Record record) {
    if (seen >= limit) {
      return false;
    }
    seen++;
    return pushRecord(record) && seen < limit;
  }
}
