package ca.gc.cra.recstream.domain.record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Ordered field-name to value mapping that flows through a stage chain.
 * <p><strong>Why:</strong> Gives stages a single unit of structured data regardless of whether input arrived as
 * text lines or already-materialized maps.</p>
 * <p><strong>Role:</strong> Domain value passed from input adapters through stages to the terminal sink.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Preserve field insertion order.</li>
 *   <li>Allow stages to read and rewrite fields in place.</li>
 *   <li>Convert back to a plain {@link Map} (deep copy) when a sink materializes the result.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mutable and not thread-safe; a record belongs to one run on one thread.</p>
 * <p><strong>Performance:</strong> Backed by a {@link LinkedHashMap}; field access is O(1).</p>
 * <p><strong>Observability:</strong> {@link #toString()} renders fields and may expose payload data; truncate before
 * logging.</p>
 *
 * @since 0.1.0
 */
public final class Record {
  private final LinkedHashMap<String, Object> fields;

  /**
   * Creates an empty record.
   */
  public Record() {
    this.fields = new LinkedHashMap<>();
  }

  /**
   * Creates a record holding a copy of the supplied mapping.
   *
   * @param source field values keyed by name; must not be {@code null}
   * @throws NullPointerException if {@code source} or any key is {@code null}
   */
  public Record(Map<String, ?> source) {
    Objects.requireNonNull(source, "source");
    this.fields = new LinkedHashMap<>(Math.max(16, source.size() * 2));
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      fields.put(Objects.requireNonNull(entry.getKey(), "field name"), entry.getValue());
    }
  }

  /**
   * Returns the value of a field.
   *
   * @param name field name
   * @return field value, or {@code null} when absent or explicitly null
   */
  public Object get(String name) {
    return fields.get(name);
  }

  /**
   * Sets a field, appending it to the field order when new.
   *
   * @param name field name; must not be {@code null}
   * @param value scalar or nested value
   * @return this record for chaining
   */
  public Record put(String name, Object value) {
    fields.put(Objects.requireNonNull(name, "name"), value);
    return this;
  }

  /**
   * Removes a field.
   *
   * @param name field name
   * @return previous value or {@code null}
   */
  public Object remove(String name) {
    return fields.remove(name);
  }

  /**
   * Indicates whether a field is present (even when its value is {@code null}).
   *
   * @param name field name
   * @return {@code true} when present
   */
  public boolean has(String name) {
    return fields.containsKey(name);
  }

  /**
   * Returns the field names in insertion order.
   *
   * @return unmodifiable view of the field names
   */
  public Set<String> fieldNames() {
    return Collections.unmodifiableSet(fields.keySet());
  }

  /**
   * Returns a read-only view of the fields, used by expression evaluation.
   *
   * @return unmodifiable live view
   */
  public Map<String, Object> view() {
    return Collections.unmodifiableMap(fields);
  }

  /**
   * Converts this record into a plain mapping with nested maps and lists copied.
   *
   * @return new mutable {@link LinkedHashMap}; caller owns the result
   */
  public Map<String, Object> asMap() {
    Map<String, Object> copy = new LinkedHashMap<>(Math.max(16, fields.size() * 2));
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      copy.put(entry.getKey(), plain(entry.getValue()));
    }
    return copy;
  }

  /**
   * Number of fields.
   *
   * @return field count
   */
  public int size() {
    return fields.size();
  }

  private static Object plain(Object value) {
    if (value instanceof Record nested) {
      return nested.asMap();
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(String.valueOf(entry.getKey()), plain(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(plain(item));
      }
      return copy;
    }
    return value;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof Record that && fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "Record" + fields;
  }
}
