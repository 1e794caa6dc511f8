package ca.gc.cra.recstream.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.recstream.domain.pipeline.PipelineSpec;
import ca.gc.cra.recstream.domain.pipeline.StageArg;
import ca.gc.cra.recstream.domain.pipeline.StageCall;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipelineDefinitionLoaderTest {

  @TempDir Path tempDir;

  private static PipelineSpec parse(String yaml) {
    return PipelineDefinitionLoader.parse(new StringReader(yaml), "inline");
  }

  @Test
  void parsesNamesAndArgumentLists() throws IOException {
    Path file = Files.writeString(tempDir.resolve("p.yaml"), """
        stages:
          - name: grep
            args: ["-v", "$.size > 10"]
          - name: head
            args: [-n, 5]
          - totable
        """);

    PipelineSpec spec = PipelineDefinitionLoader.load(file);

    assertEquals(List.of(
        new StageCall("grep", List.of(StageArg.literal("-v"), StageArg.literal("$.size > 10"))),
        new StageCall("head", List.of(StageArg.literal("-n"), StageArg.literal("5"))),
        new StageCall("totable", List.of())), spec.stages());
  }

  @Test
  void scalarArgsBecomeASingleArgument() {
    PipelineSpec spec = parse("""
        stages:
          - name: eval
            args: $.name
        """);

    assertEquals(List.of(StageArg.literal("$.name")), spec.stages().get(0).args());
  }

  @Test
  void emptyDocumentsYieldEmptyPipelines() {
    assertTrue(parse("").isEmpty());
    assertTrue(parse("stages:\n").isEmpty());
    assertTrue(parse("description: nothing to do\n").isEmpty());
  }

  @Test
  void invalidDefinitionsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> parse("stages: grep"));
    assertThrows(IllegalArgumentException.class, () -> parse("stages:\n  - args: [x]\n"));
    assertThrows(IllegalArgumentException.class, () -> parse("stages:\n  - name: grep\n    args: [[x]]\n"));
    assertThrows(IllegalArgumentException.class, () -> parse("stages:\n  - \"  \"\n"));
    assertThrows(IllegalArgumentException.class, () -> parse("stages: [unclosed"));
  }
}
