package ca.gc.cra.recstream.application.pipeline;

import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.Stage;
import ca.gc.cra.recstream.application.port.StageCatalog;
import ca.gc.cra.recstream.application.port.StageFactory;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Minimal stages that record how the engine drives them.
 */
final class TestStages implements StageCatalog {
  final List<String> events = new ArrayList<>();
  final List<List<String>> receivedArgs = new ArrayList<>();
  final Map<String, Integer> finishes = new LinkedHashMap<>();
  final Map<String, Integer> accepts = new LinkedHashMap<>();
  final List<String> creationOrder = new ArrayList<>();

  private final Map<String, StageFactory> factories = new LinkedHashMap<>();

  TestStages() {
    factories.put("pass", (args, downstream, context) -> new Recording("pass", downstream, Integer.MAX_VALUE));
    factories.put("take", (args, downstream, context) ->
        new Recording("take", downstream, Integer.parseInt(args.get(0))));
    factories.put("emit", (args, downstream, context) -> new Emitting(args, downstream));
    factories.put("mark", (args, downstream, context) -> new Marking(args.get(0), downstream));
    factories.put("args", (args, downstream, context) -> {
      receivedArgs.add(args);
      return new Recording("args", downstream, Integer.MAX_VALUE);
    });
    factories.put("broken", (args, downstream, context) -> null);
  }

  @Override
  public Optional<StageFactory> resolve(String name) {
    return Optional.ofNullable(factories.get(name));
  }

  @Override
  public Set<String> names() {
    return factories.keySet();
  }

  int finishes(String stage) {
    return finishes.getOrDefault(stage, 0);
  }

  int accepts(String stage) {
    return accepts.getOrDefault(stage, 0);
  }

  private abstract class Base implements Stage {
    final String name;
    final RecordReceiver downstream;

    Base(String name, RecordReceiver downstream) {
      this.name = name;
      this.downstream = downstream;
      creationOrder.add(name);
    }

    @Override
    public boolean wantsInput() {
      return true;
    }

    @Override
    public void finish() {
      finishes.merge(name, 1, Integer::sum);
      events.add(name + ".finish");
      downstream.finish();
    }
  }

  /** Passes everything through; asks for no more input after {@code limit} units. */
  private final class Recording extends Base {
    private final int limit;
    private int seen;

    Recording(String name, RecordReceiver downstream, int limit) {
      super(name, downstream);
      this.limit = limit;
    }

    @Override
    public boolean acceptLine(String line) {
      accepts.merge(name, 1, Integer::sum);
      seen++;
      return downstream.acceptLine(line) && seen < limit;
    }

    @Override
    public boolean acceptRecord(Record record) {
      accepts.merge(name, 1, Integer::sum);
      seen++;
      return downstream.acceptRecord(record) && seen < limit;
    }
  }

  /** Generates one {@code {"value": arg}} record per argument when finished. */
  private final class Emitting extends Base {
    private final List<String> values;

    Emitting(List<String> values, RecordReceiver downstream) {
      super("emit", downstream);
      this.values = values;
    }

    @Override
    public boolean wantsInput() {
      return false;
    }

    @Override
    public boolean acceptLine(String line) {
      throw new IllegalStateException("emit takes no input");
    }

    @Override
    public boolean acceptRecord(Record record) {
      throw new IllegalStateException("emit takes no input");
    }

    @Override
    public void finish() {
      for (String value : values) {
        if (!downstream.acceptRecord(new Record().put("value", value))) {
          break;
        }
      }
      super.finish();
    }
  }

  /** Appends its tag to the {@code trail} field so call order is observable. */
  private final class Marking extends Base {
    private final String tag;

    Marking(String tag, RecordReceiver downstream) {
      super("mark", downstream);
      this.tag = tag;
    }

    @Override
    public boolean acceptLine(String line) {
      return acceptRecord(new Record().put("line", line));
    }

    @Override
    public boolean acceptRecord(Record record) {
      Object trail = record.get("trail");
      record.put("trail", trail == null ? tag : trail + tag);
      return downstream.acceptRecord(record);
    }
  }
}
