package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.pipeline.StageConfigurationException;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * {@code topn -n N [--key field ...]}: passes the first N records of each key group, in arrival order. Without
 * keys all records form one group. Feed it sorted input to get the top N of each group.
 *
 * @since 0.1.0
 */
final class TopnStage extends AbstractStage {
  private final int limit;
  private final List<Function<Record, Object>> keys = new ArrayList<>();
  private final Map<List<Object>, Integer> counts = new HashMap<>();

  TopnStage(String name, List<String> args, RecordReceiver downstream, StageContext context) {
    super(name, downstream, context);
    StageArguments parsed = StageArguments.parse(name, args, Set.of(), Set.of("-n", "--key", "-k"));
    parsed.requireNoPositional();
    if (parsed.value("-n").isEmpty()) {
      throw new StageConfigurationException(name, "-n is required");
    }
    this.limit = parsed.nonNegativeInt("-n", 0);
    parsed.values("--key").forEach(key -> keys.add(Values.fieldReader(key)));
    parsed.values("-k").forEach(key -> keys.add(Values.fieldReader(key)));
  }

  @Override
  public boolean acceptRecord(Record record) {
    List<Object> group = new ArrayList<>(keys.size());
    for (Function<Record, Object> key : keys) {
      group.add(key.apply(record));
    }
    int count = counts.merge(group, 1, Integer::sum);
    if (count > limit) {
      return true;
    }
    return pushRecord(record);
  }
}
