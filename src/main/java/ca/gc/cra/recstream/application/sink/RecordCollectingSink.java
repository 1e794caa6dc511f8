package ca.gc.cra.recstream.application.sink;

import ca.gc.cra.recstream.application.port.RecordCodec;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.domain.record.Record;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Terminal receiver that keeps every record it is given, in arrival order.
 * <p><strong>Why:</strong> Backs the record-returning form of a run and lets embedders inspect a chain's output.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store records as plain, deep-copied field maps.</li>
 *   <li>Decode lines holding a JSON object; wrap any other line as {@code {"line": text}}.</li>
 *   <li>Never ask upstream to stop.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the run thread.</p>
 *
 * @since 0.1.0
 */
public final class RecordCollectingSink implements RecordReceiver {
  private static final Logger log = LoggerFactory.getLogger(RecordCollectingSink.class);

  /** Field name used when a plain text line reaches this sink. */
  public static final String LINE_FIELD = "line";

  private final RecordCodec codec;
  private final List<Map<String, Object>> records = new ArrayList<>();

  /**
   * Creates a sink.
   *
   * @param codec decoder for JSON lines; must not be {@code null}
   */
  public RecordCollectingSink(RecordCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public boolean acceptLine(String line) {
    if (line.stripLeading().startsWith("{")) {
      Record decoded;
      try {
        decoded = codec.decode(line);
      } catch (IllegalArgumentException ex) {
        log.debug("Line is not a JSON object; keeping it as text: {}", ex.getMessage());
        decoded = new Record().put(LINE_FIELD, line);
      }
      return acceptRecord(decoded);
    }
    return acceptRecord(new Record().put(LINE_FIELD, line));
  }

  @Override
  public boolean acceptRecord(Record record) {
    records.add(record.asMap());
    return true;
  }

  /**
   * Returns the records received so far.
   *
   * @return unmodifiable view in arrival order
   */
  public List<Map<String, Object>> records() {
    return Collections.unmodifiableList(records);
  }
}
