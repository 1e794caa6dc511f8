package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.expression.FieldPath;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.Map;
import java.util.function.Function;

/**
 * Field access and value rendering shared by the builtin stages.
 */
final class Values {
  private Values() {
    // Utility
  }

  /**
   * Builds a reader for a key argument: a JSONPath when it starts with {@code $}, otherwise a top-level field.
   */
  static Function<Record, Object> fieldReader(String key) {
    if (key.startsWith("$")) {
      FieldPath path = FieldPath.compile(key);
      return record -> path.read(record).orElse(null);
    }
    return record -> record.get(key);
  }

  static Record toRecord(Map<?, ?> map) {
    Record record = new Record();
    map.forEach((k, v) -> record.put(String.valueOf(k), v));
    return record;
  }

  /**
   * Renders a field value for text output: empty for {@code null}, plain text otherwise.
   */
  static String text(Object value) {
    return value == null ? "" : String.valueOf(value);
  }
}
