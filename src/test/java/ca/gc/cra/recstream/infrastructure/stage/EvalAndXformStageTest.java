package ca.gc.cra.recstream.infrastructure.stage;

import static ca.gc.cra.recstream.infrastructure.stage.StageHarness.records;
import static ca.gc.cra.recstream.infrastructure.stage.StageHarness.spec;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.recstream.domain.function.HostFunction;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvalAndXformStageTest {
  private final List<Map<String, Object>> input = List.of(
      Map.of("name", "a", "size", 2L),
      Map.of("name", "b", "size", 3L, "meta", Map.of("k", "v")));

  @Test
  void evalEmitsOneLinePerRecord() {
    assertEquals(List.of(Map.of("line", "a"), Map.of("line", "b")), records(spec("eval", "$.name"), input));
  }

  @Test
  void evalRendersMissingValuesAsEmptyLines() {
    assertEquals(Map.of("line", ""), records(spec("eval", "$.meta"), input).get(0));
  }

  @Test
  void evalRendersObjectsAsJson() {
    assertEquals(Map.of("k", "v"), records(spec("eval", "$.meta"), input).get(1));
  }

  @Test
  void evalTextStartingWithBraceIsKeptAsLine() {
    HostFunction brace = record -> "{" + record.get("size");

    assertEquals(List.of(Map.of("line", "{2"), Map.of("line", "{3")), records(spec("eval", brace), input));
  }

  @Test
  void xformAppliesHostFunctionInPlace() {
    HostFunction doubler = record -> record.put("double", (Long) record.get("size") * 2);

    List<Map<String, Object>> out = records(spec("xform", doubler), input);

    assertEquals(4L, out.get(0).get("double"));
    assertEquals(6L, out.get(1).get("double"));
    assertEquals("a", out.get(0).get("name"));
  }

  @Test
  void xformThenEvalSeesTheRewrittenField() {
    HostFunction tag = record -> record.put("tag", record.get("name") + "!");

    List<Map<String, Object>> out = records(spec("xform", tag).call("eval", "$.tag"), input);

    assertEquals(List.of(Map.of("line", "a!"), Map.of("line", "b!")), out);
  }
}
