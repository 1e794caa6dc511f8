package ca.gc.cra.recstream.application.sink;

import ca.gc.cra.recstream.application.port.RecordCodec;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.domain.record.Record;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * <strong>What:</strong> Terminal receiver that writes each line, followed by {@code \n}, to a {@link Writer}.
 * <p><strong>Why:</strong> Backs the streaming and in-memory text forms of a run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append exactly one line terminator per line.</li>
 *   <li>Write records as one-line JSON objects.</li>
 *   <li>Flush, but never close, the writer on {@link #finish()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the run thread.</p>
 *
 * @since 0.1.0
 */
public final class LineWritingSink implements RecordReceiver {
  private final Writer writer;
  private final RecordCodec codec;
  private long lines;

  /**
   * Creates a sink.
   *
   * @param writer destination; owned by the caller
   * @param codec encoder for records; must not be {@code null}
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Output writer is caller-owned; lines are streamed straight into it.")
  public LineWritingSink(Writer writer, RecordCodec codec) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * @throws UncheckedIOException if the writer fails
   */
  @Override
  public boolean acceptLine(String line) {
    try {
      writer.write(line);
      writer.write('\n');
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write output line " + (lines + 1), ex);
    }
    lines++;
    return true;
  }

  @Override
  public boolean acceptRecord(Record record) {
    return acceptLine(codec.encode(record));
  }

  @Override
  public void finish() {
    try {
      writer.flush();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to flush output", ex);
    }
  }

  /**
   * Number of lines written.
   *
   * @return line count
   */
  public long linesWritten() {
    return lines;
  }
}
