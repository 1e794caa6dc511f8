package ca.gc.cra.recstream.infrastructure.stage;

import static ca.gc.cra.recstream.infrastructure.stage.StageHarness.records;
import static ca.gc.cra.recstream.infrastructure.stage.StageHarness.spec;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.recstream.application.pipeline.StageConfigurationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TopnStageTest {
  private final List<Map<String, Object>> input = List.of(
      Map.of("g", "x", "n", 1L),
      Map.of("g", "y", "n", 2L),
      Map.of("g", "x", "n", 3L),
      Map.of("g", "x", "n", 4L),
      Map.of("g", "y", "n", 5L));

  @Test
  void keepsFirstNPerGroupAsRecords() {
    List<Map<String, Object>> out = records(spec("topn", "-n", "1", "--key", "g"), input);

    assertEquals(List.of(input.get(0), input.get(1)), out);
  }

  @Test
  void withoutKeysActsOnTheWholeStream() {
    assertEquals(List.of(input.get(0), input.get(1), input.get(2)), records(spec("topn", "-n", "3"), input));
  }

  @Test
  void countIsRequired() {
    assertThrows(StageConfigurationException.class, () -> records(spec("topn", "--key", "g"), input));
  }
}
