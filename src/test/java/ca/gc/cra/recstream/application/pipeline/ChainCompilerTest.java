package ca.gc.cra.recstream.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.recstream.application.bridge.HostFunctionBridge;
import ca.gc.cra.recstream.application.bridge.HostFunctionRegistry;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.application.sink.RecordCollectingSink;
import ca.gc.cra.recstream.domain.pipeline.PipelineSpec;
import ca.gc.cra.recstream.infrastructure.json.JacksonRecordCodec;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChainCompilerTest {
  private final TestStages stages = new TestStages();
  private final HostFunctionRegistry registry = new HostFunctionRegistry();
  private final ChainCompiler compiler = new ChainCompiler(stages, new HostFunctionBridge(registry));
  private final JacksonRecordCodec codec = new JacksonRecordCodec();

  @Test
  void emptySpecCompilesToTheSink() {
    RecordCollectingSink sink = new RecordCollectingSink(codec);

    Chain chain = compiler.compile(PipelineSpec.empty(), sink, new StageContext(registry, codec));

    assertTrue(chain.head().isEmpty());
    assertSame(sink, chain.entry());
    assertTrue(chain.wantsInput());
    assertEquals(List.of(), chain.stageNames());
  }

  @Test
  void nodesLinkInCallOrderAndEndAtSink() {
    RecordCollectingSink sink = new RecordCollectingSink(codec);

    Chain chain = compiler.compile(PipelineSpec.empty().call("emit", "x").call("pass"), sink,
        new StageContext(registry, codec));

    assertEquals(List.of("emit", "pass"), chain.stageNames());
    ChainNode head = chain.head().orElseThrow();
    assertFalse(chain.wantsInput());
    assertSame(sink, head.outputSink());
    ChainNode second = (ChainNode) head.downstream();
    assertSame(sink, second.downstream());
  }

  @Test
  void literalArgumentsReachTheFactoryUnchanged() {
    compiler.compile(PipelineSpec.empty().call("args", "-n", "3", "$.a == 'b'"),
        new RecordCollectingSink(codec), new StageContext(registry, codec));

    assertEquals(List.of(List.of("-n", "3", "$.a == 'b'")), stages.receivedArgs);
    assertEquals(0, registry.size());
  }
}
