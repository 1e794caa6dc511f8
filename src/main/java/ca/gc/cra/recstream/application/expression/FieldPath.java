package ca.gc.cra.recstream.application.expression;

import ca.gc.cra.recstream.domain.record.Record;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal JSONPath-style field reference supporting {@code $}, dotted names, quoted names, and array indices
 * (e.g., {@code $.user.tags[0]} or {@code $['first name']}).
 *
 * @since 0.1.0
 */
public final class FieldPath {
  private final String text;
  private final List<Step> steps;

  private FieldPath(String text, List<Step> steps) {
    this.text = text;
    this.steps = steps;
  }

  /**
   * Compiles a complete path expression.
   *
   * @param expression path text starting with {@code $}
   * @return compiled path
   * @throws ExpressionException when the path is malformed or followed by other text
   */
  public static FieldPath compile(String expression) {
    String trimmed = expression == null ? "" : expression.trim();
    Parsed parsed = parse(trimmed, 0);
    if (parsed.end() != trimmed.length()) {
      throw new ExpressionException("Unexpected text after field path: " + expression);
    }
    return parsed.path();
  }

  /**
   * Parses a path embedded in a larger expression.
   *
   * @param source expression text
   * @param start index of the leading {@code $}
   * @return compiled path and the index just past it
   */
  static Parsed parse(String source, int start) {
    if (start >= source.length() || source.charAt(start) != '$') {
      throw new ExpressionException("Field path must start with $: " + source);
    }
    List<Step> steps = new ArrayList<>();
    int i = start + 1;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (c == '.') {
        int nameStart = ++i;
        while (i < source.length() && isNameChar(source.charAt(i))) {
          i++;
        }
        if (nameStart == i) {
          throw new ExpressionException("Empty field name in path: " + source);
        }
        steps.add(new FieldStep(source.substring(nameStart, i)));
      } else if (c == '[') {
        i++;
        if (i >= source.length()) {
          throw new ExpressionException("Unterminated bracket in path: " + source);
        }
        char next = source.charAt(i);
        if (next == '\'' || next == '"') {
          Literals.Scanned scanned = Literals.scanQuoted(source, i);
          i = scanned.end();
          steps.add(new FieldStep(scanned.value()));
        } else {
          int digitsStart = i;
          while (i < source.length() && Character.isDigit(source.charAt(i))) {
            i++;
          }
          if (digitsStart == i) {
            throw new ExpressionException("Invalid array index in path: " + source);
          }
          steps.add(new IndexStep(Integer.parseInt(source.substring(digitsStart, i))));
        }
        if (i >= source.length() || source.charAt(i) != ']') {
          throw new ExpressionException("Missing closing ] in path: " + source);
        }
        i++;
      } else {
        break;
      }
    }
    return new Parsed(new FieldPath(source.substring(start, i), List.copyOf(steps)), i);
  }

  /**
   * Reads the referenced value from a record.
   *
   * @param record record to read
   * @return value, or empty when any step is missing or the value is {@code null}
   */
  public Optional<Object> read(Record record) {
    Object current = record;
    for (Step step : steps) {
      if (current == null) {
        return Optional.empty();
      }
      current = step.resolve(current);
      if (current == Step.MISSING) {
        return Optional.empty();
      }
    }
    return Optional.ofNullable(current);
  }

  /**
   * Indicates whether this path is the bare {@code $} (the whole record).
   *
   * @return {@code true} for the root path
   */
  public boolean isRoot() {
    return steps.isEmpty();
  }

  @Override
  public String toString() {
    return text;
  }

  private static boolean isNameChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '-';
  }

  record Parsed(FieldPath path, int end) {}

  private sealed interface Step permits FieldStep, IndexStep {
    Object MISSING = new Object();

    Object resolve(Object current);
  }

  private record FieldStep(String name) implements Step {
    @Override
    public Object resolve(Object current) {
      if (current instanceof Record record) {
        return record.has(name) ? record.get(name) : MISSING;
      }
      if (current instanceof Map<?, ?> map) {
        return map.containsKey(name) ? map.get(name) : MISSING;
      }
      return MISSING;
    }
  }

  private record IndexStep(int index) implements Step {
    @Override
    public Object resolve(Object current) {
      if (current instanceof List<?> list && index < list.size()) {
        return list.get(index);
      }
      return MISSING;
    }
  }
}
