package ca.gc.cra.recstream.infrastructure.stage;

import static ca.gc.cra.recstream.infrastructure.stage.StageHarness.records;
import static ca.gc.cra.recstream.infrastructure.stage.StageHarness.run;
import static ca.gc.cra.recstream.infrastructure.stage.StageHarness.spec;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.recstream.application.expression.ExpressionException;
import ca.gc.cra.recstream.application.pipeline.InvalidRecordException;
import ca.gc.cra.recstream.application.pipeline.PipelineInput;
import ca.gc.cra.recstream.application.pipeline.StageConfigurationException;
import ca.gc.cra.recstream.domain.function.HostFunction;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GrepStageTest {
  private final List<Map<String, Object>> input = List.of(
      Map.of("name", "a", "size", 1L),
      Map.of("name", "b", "size", 5L),
      Map.of("name", "c", "size", 9L));

  @Test
  void keepsMatchingRecords() {
    assertEquals(List.of(input.get(1), input.get(2)), records(spec("grep", "$.size > 2"), input));
  }

  @Test
  void invertedMatchKeepsTheRest() {
    assertEquals(List.of(input.get(0)), records(spec("grep", "-v", "$.size > 2"), input));
  }

  @Test
  void hostFunctionPredicate() {
    HostFunction odd = record -> ((Long) record.get("size")) % 2 == 1;

    assertEquals(3, records(spec("grep", odd), input).size());
    assertEquals(List.of(), records(spec("grep", "-v", odd), input));
  }

  @Test
  void decodesJsonLines() {
    List<Map<String, Object>> out = run(spec("grep", "$.ok"),
        PipelineInput.fromLines("{\"ok\":true,\"i\":1}", "{\"ok\":false,\"i\":2}")).records();

    assertEquals(List.of(Map.of("ok", true, "i", 1L)), out);
  }

  @Test
  void malformedLineReportsStageAndPosition() {
    InvalidRecordException ex = assertThrows(InvalidRecordException.class,
        () -> run(spec("grep", "$.ok"), PipelineInput.fromLines("{\"ok\":true}", "not json")));

    assertTrue(ex.getMessage().startsWith("grep at lines:2"), ex.getMessage());
  }

  @Test
  void failingHostFunctionIsWrapped() {
    HostFunction boom = record -> {
      throw new IllegalStateException("boom");
    };

    ExpressionException ex = assertThrows(ExpressionException.class,
        () -> records(spec("grep", boom), input));
    assertTrue(ex.getMessage().contains("grep at records:1"), ex.getMessage());
  }

  @Test
  void requiresExactlyOneExpression() {
    assertThrows(StageConfigurationException.class, () -> records(spec("grep"), input));
    assertThrows(StageConfigurationException.class, () -> records(spec("grep", "$.a", "$.b"), input));
    assertThrows(StageConfigurationException.class, () -> records(spec("grep", "$.a =="), input));
    assertThrows(StageConfigurationException.class, () -> records(spec("grep", "--nope", "$.a"), input));
  }
}
