package ca.gc.cra.recstream.infrastructure.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.recstream.application.port.StageFactory;
import ca.gc.cra.recstream.infrastructure.json.JacksonRecordCodec;
import java.util.List;
import org.junit.jupiter.api.Test;

class BuiltinStageCatalogTest {
  private final BuiltinStageCatalog catalog = BuiltinStageCatalog.create(new JacksonRecordCodec());

  @Test
  void listsBuiltinStagesSorted() {
    assertEquals(List.of("eval", "fromjson", "grep", "head", "sort", "tojson", "topn", "totable", "xform"),
        List.copyOf(catalog.names()));
  }

  @Test
  void resolvesNamesCaseInsensitively() {
    assertTrue(catalog.resolve("GREP").isPresent());
    assertTrue(catalog.resolve(" totable ").isPresent());
    assertFalse(catalog.resolve("nope").isPresent());
    assertFalse(catalog.resolve(null).isPresent());
  }

  @Test
  void withAddsAStageWithoutChangingTheOriginal() {
    StageFactory factory = (args, downstream, context) -> new ToJsonStage("dump", args, downstream, context);

    BuiltinStageCatalog extended = catalog.with("Dump", factory);

    assertTrue(extended.resolve("dump").isPresent());
    assertFalse(catalog.resolve("dump").isPresent());
  }
}
