package ca.gc.cra.recstream.application.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.recstream.domain.record.Record;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FieldPathTest {

  @Test
  void readsThroughRecordsMapsAndLists() {
    Record record = new Record()
        .put("user", new Record().put("id", 7L))
        .put("tags", List.of(Map.of("k", "v")));

    assertEquals(Optional.of(7L), FieldPath.compile("$.user.id").read(record));
    assertEquals(Optional.of("v"), FieldPath.compile("$.tags[0].k").read(record));
    assertEquals(Optional.empty(), FieldPath.compile("$.user.name").read(record));
    assertEquals(Optional.empty(), FieldPath.compile("$.tags.k").read(record));
  }

  @Test
  void quotedSegmentsAllowAnyFieldName() {
    Record record = new Record().put("a b", 1L);

    assertEquals(Optional.of(1L), FieldPath.compile("$['a b']").read(record));
  }

  @Test
  void rootPathIsRecognised() {
    assertTrue(FieldPath.compile("$").isRoot());
    assertEquals("$.a", FieldPath.compile(" $.a ").toString());
  }

  @Test
  void invalidPathsAreRejected() {
    assertThrows(ExpressionException.class, () -> FieldPath.compile("a.b"));
    assertThrows(ExpressionException.class, () -> FieldPath.compile("$."));
    assertThrows(ExpressionException.class, () -> FieldPath.compile("$[x]"));
    assertThrows(ExpressionException.class, () -> FieldPath.compile("$[0"));
    assertThrows(ExpressionException.class, () -> FieldPath.compile("$.a b"));
  }
}
