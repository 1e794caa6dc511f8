package ca.gc.cra.recstream.application.pipeline;

import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes one {@link PipelineInput} into a compiled {@link Chain} and finishes it.
 *
 * <p>Streams and lines stop being read the first time the entry receiver returns {@code false}; the rest of a
 * stream stays unread. Records are always delivered in full. {@link Chain#finish()} runs exactly once whenever
 * the chain was driven, including after an early stop or on empty input.</p>
 *
 * @since 0.1.0
 */
final class InputDriver {
  private static final Logger log = LoggerFactory.getLogger(InputDriver.class);

  /**
   * Outcome of driving one chain.
   *
   * @param units lines or records pushed into the chain
   * @param stoppedEarly whether the chain asked to stop before input ran out
   */
  record Outcome(long units, boolean stoppedEarly) {}

  Outcome drive(Chain chain, PipelineInput input, StageContext context) throws IOException {
    Outcome outcome = new Outcome(0, false);
    if (chain.wantsInput()) {
      if (input == null) {
        if (chain.head().isPresent()) {
          throw new InputRequiredException(chain.head().get().stageName());
        }
      } else {
        outcome = feed(chain.entry(), input, context);
      }
    } else if (input != null) {
      log.debug("Head stage {} generates its own input; supplied input ignored",
          chain.head().map(ChainNode::stageName).orElse(StageContext.NO_SOURCE));
    }
    chain.finish();
    return outcome;
  }

  private static Outcome feed(RecordReceiver entry, PipelineInput input, StageContext context)
      throws IOException {
    long units = 0;
    if (input instanceof PipelineInput.FromStream stream) {
      context.beginSource(stream.sourceName());
      BufferedReader reader = stream.reader();
      String line;
      while ((line = reader.readLine()) != null) {
        units++;
        context.nextUnit();
        if (!entry.acceptLine(line)) {
          return new Outcome(units, true);
        }
      }
    } else if (input instanceof PipelineInput.FromLines lines) {
      context.beginSource("lines");
      for (String line : lines.lines()) {
        units++;
        context.nextUnit();
        if (!entry.acceptLine(line)) {
          return new Outcome(units, true);
        }
      }
    } else if (input instanceof PipelineInput.FromRecords records) {
      context.beginSource("records");
      for (Map<String, Object> fields : records.records()) {
        units++;
        context.nextUnit();
        entry.acceptRecord(new Record(fields));
      }
    }
    return new Outcome(units, false);
  }
}
