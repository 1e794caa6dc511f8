package ca.gc.cra.recstream.application.bridge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.recstream.application.expression.RecordExpression;
import ca.gc.cra.recstream.domain.function.HostFunction;
import ca.gc.cra.recstream.domain.pipeline.StageArg;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.List;
import org.junit.jupiter.api.Test;

class HostFunctionBridgeTest {
  private final HostFunctionRegistry registry = new HostFunctionRegistry();
  private final HostFunctionBridge bridge = new HostFunctionBridge(registry);

  @Test
  void literalsPassThroughAndFunctionsBecomeInvocations() {
    HostFunction fn = HostFunction.named("price check", record -> record.get("price"));

    List<String> processed = bridge.process(List.of(StageArg.literal("-v"), StageArg.function(fn)));

    assertEquals("-v", processed.get(0));
    String token = registry.register(fn).value();
    assertEquals("# price check\nhost('" + token + "', $r)", processed.get(1));
  }

  @Test
  void bridgedTextEvaluatesToTheFunctionResult() {
    HostFunction fn = record -> ((Long) record.get("n")) * 2;

    String text = bridge.bridge(fn).text();
    Object result = RecordExpression.compile(text).evaluate(new Record().put("n", 21L), registry);

    assertEquals(42L, result);
  }

  @Test
  void sameFunctionBridgesToIdenticalText() {
    HostFunction fn = record -> true;

    assertEquals(bridge.bridge(fn).text(), bridge.bridge(fn).text());
    assertEquals(1, registry.size());
  }

  @Test
  void multiLineDescriptionsAreCommentedLineByLine() {
    HostFunction fn = HostFunction.named("first\nsecond", record -> true);

    String text = bridge.bridge(fn).text();

    assertTrue(text.startsWith("# first\n# second\nhost('"));
    assertTrue(RecordExpression.compile(text).test(new Record(), registry));
  }

  @Test
  void blankDescriptionsAddNoComment() {
    HostFunction fn = HostFunction.named(" ", record -> true);

    assertFalse(bridge.bridge(fn).text().startsWith("#"));
  }
}
