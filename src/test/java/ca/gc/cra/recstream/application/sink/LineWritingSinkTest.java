package ca.gc.cra.recstream.application.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.recstream.domain.record.Record;
import ca.gc.cra.recstream.infrastructure.json.JacksonRecordCodec;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import org.junit.jupiter.api.Test;

class LineWritingSinkTest {

  @Test
  void writesLinesAndEncodedRecords() {
    StringWriter out = new StringWriter();
    LineWritingSink sink = new LineWritingSink(out, new JacksonRecordCodec());

    sink.acceptLine("hello");
    sink.acceptRecord(new Record().put("a", 1).put("b", "x"));
    sink.finish();

    assertEquals("hello\n{\"a\":1,\"b\":\"x\"}\n", out.toString());
    assertEquals(2, sink.linesWritten());
  }

  @Test
  void finishFlushesWithoutClosing() throws IOException {
    StringWriter target = new StringWriter();
    TrackingWriter writer = new TrackingWriter(new BufferedWriter(target));
    LineWritingSink sink = new LineWritingSink(writer, new JacksonRecordCodec());

    sink.acceptLine("a");
    sink.finish();

    assertEquals("a\n", target.toString());
    assertFalse(writer.closed);
    writer.write("still open");
  }

  @Test
  void writeFailuresAreWrapped() {
    Writer failing = new Writer() {
      @Override
      public void write(char[] cbuf, int off, int len) throws IOException {
        throw new IOException("closed pipe");
      }

      @Override
      public void flush() {}

      @Override
      public void close() {}
    };
    LineWritingSink sink = new LineWritingSink(failing, new JacksonRecordCodec());

    UncheckedIOException ex = assertThrows(UncheckedIOException.class, () -> sink.acceptLine("a"));
    assertEquals("closed pipe", ex.getCause().getMessage());
  }

  private static final class TrackingWriter extends Writer {
    private final Writer delegate;
    private boolean closed;

    TrackingWriter(Writer delegate) {
      this.delegate = delegate;
    }

    @Override
    public void write(char[] cbuf, int off, int len) throws IOException {
      delegate.write(cbuf, off, len);
    }

    @Override
    public void flush() throws IOException {
      delegate.flush();
    }

    @Override
    public void close() throws IOException {
      closed = true;
      delegate.close();
    }
  }
}
