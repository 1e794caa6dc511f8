package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code totable}: buffers records and emits an aligned text table on finish.
 *
 * <p>Columns are the union of field names in order of first appearance. The header is followed by a row of
 * dashes; cells are left-aligned and separated by two spaces, and trailing blanks are trimmed.</p>
 *
 * @since 0.1.0
 */
final class ToTableStage extends AbstractStage {
  private static final String SEPARATOR = "  ";

  private final List<Record> rows = new ArrayList<>();

  ToTableStage(String name, List<String> args, RecordReceiver downstream, StageContext context) {
    super(name, downstream, context);
    StageArguments.parse(name, args, Set.of(), Set.of()).requireNoPositional();
  }

  @Override
  public boolean acceptRecord(Record record) {
    rows.add(record);
    return true;
  }

  @Override
  protected void onFinish() {
    if (rows.isEmpty()) {
      return;
    }
    Map<String, Integer> widths = new LinkedHashMap<>();
    for (Record row : rows) {
      for (String field : row.fieldNames()) {
        widths.merge(field, field.length(), Math::max);
      }
    }
    List<List<String>> cells = new ArrayList<>(rows.size());
    for (Record row : rows) {
      List<String> line = new ArrayList<>(widths.size());
      for (String field : widths.keySet()) {
        String text = cell(row.get(field));
        widths.merge(field, text.length(), Math::max);
        line.add(text);
      }
      cells.add(line);
    }
    List<String> header = new ArrayList<>(widths.keySet());
    List<String> dashes = new ArrayList<>(widths.size());
    widths.values().forEach(width -> dashes.add("-".repeat(width)));
    if (!pushLine(format(header, widths)) || !pushLine(format(dashes, widths))) {
      return;
    }
    for (List<String> line : cells) {
      if (!pushLine(format(line, widths))) {
        return;
      }
    }
    rows.clear();
  }

  private String cell(Object value) {
    if (value instanceof Record nested) {
      return context().codec().encode(nested);
    }
    if (value instanceof Map<?, ?> map) {
      return context().codec().encode(Values.toRecord(map));
    }
    return Values.text(value);
  }

  private static String format(List<String> values, Map<String, Integer> widths) {
    StringBuilder sb = new StringBuilder();
    int i = 0;
    for (int width : widths.values()) {
      if (i > 0) {
        sb.append(SEPARATOR);
      }
      String value = values.get(i++);
      sb.append(value).append(" ".repeat(Math.max(0, width - value.length())));
    }
    return sb.toString().stripTrailing();
  }
}
