package ca.gc.cra.recstream.infrastructure.stage;

import static ca.gc.cra.recstream.infrastructure.stage.StageHarness.run;
import static ca.gc.cra.recstream.infrastructure.stage.StageHarness.spec;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import ca.gc.cra.recstream.application.pipeline.PipelineInput;
import ca.gc.cra.recstream.application.pipeline.PipelineResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextStagesTest {

  @Test
  void totableAlignsColumnsUnderAHeader() {
    PipelineResult result = run(spec("totable"), PipelineInput.fromLines(
        "{\"name\":\"alpha\",\"n\":1}",
        "{\"name\":\"b\",\"n\":22}"));

    assertInstanceOf(PipelineResult.Text.class, result);
    assertEquals(String.join("\n",
        "name   n",
        "-----  --",
        "alpha  1",
        "b      22",
        ""), result.text());
  }

  @Test
  void totableUsesTheUnionOfFields() {
    PipelineResult result = run(spec("totable"), PipelineInput.fromLines("{\"a\":1}", "{\"b\":2}"));

    assertEquals("a  b\n-  -\n1\n   2\n", result.text());
  }

  @Test
  void totableWithNoRecordsPrintsNothing() {
    assertEquals("", run(spec("totable"), PipelineInput.fromRecords(List.of())).text());
  }

  @Test
  void tojsonWritesOneObjectPerLine() {
    PipelineResult result = run(spec("grep", "$.keep").call("tojson"), PipelineInput.fromLines(
        "{\"keep\":true,\"v\":\"x\"}",
        "{\"keep\":false,\"v\":\"y\"}"));

    assertEquals("{\"keep\":true,\"v\":\"x\"}\n", result.text());
  }
}
