package ca.gc.cra.recstream.domain.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RecordTest {

  @Test
  void preservesFieldOrder() {
    Record record = new Record().put("b", 1).put("a", 2).put("c", 3);

    assertEquals(List.of("b", "a", "c"), new ArrayList<>(record.fieldNames()));
  }

  @Test
  void distinguishesAbsentFromNull() {
    Record record = new Record().put("present", null);

    assertTrue(record.has("present"));
    assertFalse(record.has("absent"));
    assertEquals(null, record.remove("present"));
    assertEquals(0, record.size());
  }

  @Test
  void asMapDeepCopiesNestedValues() {
    List<Object> items = new ArrayList<>(List.of(1));
    Map<String, Object> nested = new LinkedHashMap<>(Map.of("k", "v"));
    Record record = new Record().put("items", items).put("nested", nested).put("child", new Record().put("x", 1));

    Map<String, Object> copy = record.asMap();
    items.add(2);
    nested.put("k2", "v2");

    assertEquals(List.of(1), copy.get("items"));
    assertEquals(Map.of("k", "v"), copy.get("nested"));
    assertEquals(Map.of("x", 1), copy.get("child"));
    assertNotSame(nested, copy.get("nested"));
  }

  @Test
  void viewIsReadOnly() {
    Record record = new Record().put("a", 1);

    assertThrows(UnsupportedOperationException.class, () -> record.view().put("b", 2));
  }

  @Test
  void nullFieldNamesAreRejected() {
    assertThrows(NullPointerException.class, () -> new Record().put(null, 1));
    Map<String, Object> source = new HashMap<>();
    source.put(null, 1);
    assertThrows(NullPointerException.class, () -> new Record(source));
  }
}
