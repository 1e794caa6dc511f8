package ca.gc.cra.recstream.application.port;

import ca.gc.cra.recstream.domain.record.Record;

/**
 * <strong>What:</strong> Text form of a record, used wherever a line meets a record.
 * <p><strong>Why:</strong> Between text tools records travel as single-line JSON objects; stages that receive lines
 * but operate on records, and sinks that write records as lines, share this conversion.</p>
 * <p><strong>Role:</strong> Port implemented by the JSON adapter.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface RecordCodec {
  /**
   * Parses one line holding a JSON object.
   *
   * @param line line text
   * @return decoded record
   * @throws IllegalArgumentException when the line is not a single JSON object
   */
  Record decode(String line);

  /**
   * Serializes a record as a single line of JSON without a terminator.
   *
   * @param record record to encode
   * @return JSON text
   */
  String encode(Record record);
}
