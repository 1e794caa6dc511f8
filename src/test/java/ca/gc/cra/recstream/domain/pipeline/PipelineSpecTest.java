package ca.gc.cra.recstream.domain.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.recstream.domain.function.HostFunction;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PipelineSpecTest {

  @Test
  void callAppendsWithoutMutatingTheOriginal() {
    PipelineSpec base = PipelineSpec.empty().call("grep", "$.a == 1");
    PipelineSpec extended = base.call("head", "-n", "2");

    assertEquals(1, base.size());
    assertEquals(List.of("grep", "head"), extended.stages().stream().map(StageCall::name).toList());
    assertEquals(List.of(StageArg.literal("-n"), StageArg.literal("2")), extended.stages().get(1).args());
  }

  @Test
  void concatIsAssociative() {
    PipelineSpec a = PipelineSpec.empty().call("a");
    PipelineSpec b = PipelineSpec.empty().call("b");
    PipelineSpec c = PipelineSpec.empty().call("c");

    assertEquals(a.concat(b).concat(c), a.concat(b.concat(c)));
    assertEquals(a.concat(b), a.then(b));
  }

  @Test
  void emptyIsTheIdentityOfConcat() {
    PipelineSpec a = PipelineSpec.empty().call("a", "x");

    assertSame(a, a.concat(PipelineSpec.empty()));
    assertSame(a, PipelineSpec.empty().concat(a));
    assertTrue(PipelineSpec.empty().isEmpty());
    assertEquals(Optional.empty(), PipelineSpec.empty().lastStageName());
  }

  @Test
  void lastStageNameReflectsTheFinalCall() {
    PipelineSpec spec = PipelineSpec.empty().call("grep", "$r").concat(PipelineSpec.empty().call("totable"));

    assertEquals(Optional.of("totable"), spec.lastStageName());
  }

  @Test
  void hostFunctionArgumentsKeepIdentity() {
    HostFunction fn = record -> true;

    PipelineSpec spec = PipelineSpec.empty().call("grep", fn);

    StageArg arg = spec.stages().get(0).args().get(0);
    StageArg.HostFunctionArg hostArg = assertInstanceOf(StageArg.HostFunctionArg.class, arg);
    assertSame(fn, hostArg.function());
    assertEquals(StageArg.function(fn), arg);
    assertNotEquals(StageArg.function(record -> true), arg);
  }

  @Test
  void listOfStringsIsTakenAsLiteralArguments() {
    PipelineSpec spec = PipelineSpec.empty().call("grep", List.of("-v", "$.x"));

    assertEquals(List.of(StageArg.literal("-v"), StageArg.literal("$.x")), spec.stages().get(0).args());
    assertEquals(spec, PipelineSpec.empty().call("grep", "-v", "$.x"));
  }

  @Test
  void unsupportedArgumentTypesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> PipelineSpec.empty().call("head", List.of(3)));
    assertThrows(IllegalArgumentException.class, () -> PipelineSpec.empty().call("head", 3));
    assertThrows(NullPointerException.class, () -> PipelineSpec.empty().call(null, List.of()));
  }

  @Test
  void toStringRendersPipeSeparatedStages() {
    PipelineSpec spec = PipelineSpec.empty().call("grep", "$.a").call("totable");

    assertEquals("PipelineSpec[grep [$.a] | totable]", spec.toString());
  }
}
