package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.pipeline.StageConfigurationException;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * {@code sort --key <field>[=[-]numeric|lexical] ...}: buffers every record and emits them sorted on finish.
 *
 * <p>Keys are applied in order. A leading {@code -} on the type sorts descending. Missing values, and values that
 * are not numbers under a numeric key, sort after all others in either direction. Ties keep arrival order.</p>
 *
 * @since 0.1.0
 */
final class SortStage extends AbstractStage {
  private final Comparator<Record> order;
  private final List<Record> buffer = new ArrayList<>();

  SortStage(String name, List<String> args, RecordReceiver downstream, StageContext context) {
    super(name, downstream, context);
    StageArguments parsed = StageArguments.parse(name, args, Set.of(), Set.of("--key", "-k"));
    parsed.requireNoPositional();
    List<String> keys = new ArrayList<>(parsed.values("--key"));
    keys.addAll(parsed.values("-k"));
    if (keys.isEmpty()) {
      throw new StageConfigurationException(name, "at least one --key is required");
    }
    Comparator<Record> combined = null;
    for (String key : keys) {
      Comparator<Record> next = keyComparator(name, key);
      combined = combined == null ? next : combined.thenComparing(next);
    }
    this.order = combined;
  }

  @Override
  public boolean acceptRecord(Record record) {
    buffer.add(record);
    return true;
  }

  @Override
  protected void onFinish() {
    buffer.sort(order);
    for (Record record : buffer) {
      if (!pushRecord(record)) {
        break;
      }
    }
    buffer.clear();
  }

  static Comparator<Record> keyComparator(String stageName, String spec) {
    int eq = spec.lastIndexOf('=');
    String field = eq < 0 ? spec : spec.substring(0, eq);
    String type = eq < 0 ? "lexical" : spec.substring(eq + 1).trim().toLowerCase(Locale.ROOT);
    if (field.isBlank()) {
      throw new StageConfigurationException(stageName, "empty sort key in '" + spec + "'");
    }
    boolean descending = type.startsWith("-");
    if (descending) {
      type = type.substring(1);
    }
    Function<Record, Object> reader = Values.fieldReader(field);
    Comparator<Record> comparator;
    switch (type) {
      case "numeric", "n" -> {
        Comparator<Double> values = descending ? Comparator.reverseOrder() : Comparator.naturalOrder();
        comparator = Comparator.<Record, Double>comparing(record -> numeric(reader.apply(record)),
            Comparator.nullsLast(values));
      }
      case "lexical", "l", "" -> {
        Comparator<String> values = descending ? Comparator.reverseOrder() : Comparator.naturalOrder();
        comparator = Comparator.<Record, String>comparing(record -> lexical(reader.apply(record)),
            Comparator.nullsLast(values));
      }
      default -> throw new StageConfigurationException(stageName,
          "unknown sort type '" + type + "' in '" + spec + "' (expected numeric or lexical)");
    }
    return comparator;
  }

  private static Double numeric(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof CharSequence text) {
      try {
        return Double.valueOf(text.toString().trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }

  private static String lexical(Object value) {
    return value == null ? null : String.valueOf(value);
  }
}
