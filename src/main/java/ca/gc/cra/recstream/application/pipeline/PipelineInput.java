package ca.gc.cra.recstream.application.pipeline;

import ca.gc.cra.recstream.logging.Logs;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> The three shapes of input a pipeline run accepts.
 * <p><strong>Why:</strong> Streams and in-memory lines are driven line by line and honor early stop; in-memory
 * records skip parsing and go straight to {@code acceptRecord}.</p>
 * <p><strong>Role:</strong> Value passed to {@link PipelineRunner#run}; never closes the streams it wraps.</p>
 *
 * @since 0.1.0
 */
public sealed interface PipelineInput
    permits PipelineInput.FromStream, PipelineInput.FromLines, PipelineInput.FromRecords {

  /** Source label for the process standard input. */
  String STDIN = "stdin";

  /**
   * Wraps a byte stream decoded as UTF-8. {@link System#in} is labelled {@code stdin}.
   *
   * @param in stream to read; left open
   * @return stream input
   */
  static PipelineInput fromStream(InputStream in) {
    Objects.requireNonNull(in, "in");
    String name = in == System.in ? STDIN : anonymousName(in);
    return new FromStream(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), name);
  }

  /**
   * Wraps a character stream.
   *
   * @param reader reader; left open
   * @return stream input labelled {@code stream#<id>}
   */
  static PipelineInput fromStream(Reader reader) {
    Objects.requireNonNull(reader, "reader");
    return fromStream(reader, anonymousName(reader));
  }

  /**
   * Wraps a character stream under an explicit source label used in error positions.
   *
   * @param reader reader; left open
   * @param sourceName label such as a file path
   * @return stream input
   */
  static PipelineInput fromStream(Reader reader, String sourceName) {
    Objects.requireNonNull(reader, "reader");
    BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
    return new FromStream(buffered, sourceName);
  }

  /**
   * Wraps an in-memory sequence of lines.
   *
   * @param lines lines without terminators
   * @return lines input
   */
  static PipelineInput fromLines(List<String> lines) {
    return new FromLines(lines);
  }

  /**
   * Wraps in-memory lines given as varargs.
   *
   * @param lines lines without terminators
   * @return lines input
   */
  static PipelineInput fromLines(String... lines) {
    return new FromLines(List.of(lines));
  }

  /**
   * Wraps an in-memory sequence of records.
   *
   * @param records field maps; copied
   * @return records input
   */
  static PipelineInput fromRecords(List<? extends Map<String, ?>> records) {
    Objects.requireNonNull(records, "records");
    List<Map<String, Object>> copy = new ArrayList<>(records.size());
    for (Map<String, ?> record : records) {
      copy.add(new LinkedHashMap<>(Objects.requireNonNull(record, "record")));
    }
    return new FromRecords(copy);
  }

  /**
   * Classifies an untyped value: a stream, a collection of strings, or a collection of maps.
   *
   * @param value candidate input
   * @return typed input
   * @throws UnsupportedInputException if the value has none of the supported shapes
   */
  @SuppressWarnings("unchecked")
  static PipelineInput of(Object value) {
    if (value instanceof PipelineInput input) {
      return input;
    }
    if (value instanceof InputStream in) {
      return fromStream(in);
    }
    if (value instanceof Reader reader) {
      return fromStream(reader);
    }
    if (value instanceof Collection<?> items) {
      if (items.stream().allMatch(item -> item instanceof CharSequence)) {
        List<String> lines = new ArrayList<>(items.size());
        items.forEach(item -> lines.add(item.toString()));
        return new FromLines(lines);
      }
      if (items.stream().allMatch(item -> item instanceof Map<?, ?> map
          && map.keySet().stream().allMatch(String.class::isInstance))) {
        return fromRecords(new ArrayList<>((Collection<? extends Map<String, ?>>) items));
      }
    }
    throw new UnsupportedInputException(Logs.describe(value));
  }

  private static String anonymousName(Object stream) {
    return "stream#" + Integer.toHexString(System.identityHashCode(stream));
  }

  /**
   * Line-oriented stream input.
   *
   * @param reader buffered reader over the stream
   * @param sourceName label used in error positions
   */
  record FromStream(BufferedReader reader, String sourceName) implements PipelineInput {
    public FromStream {
      Objects.requireNonNull(reader, "reader");
      sourceName = sourceName == null || sourceName.isBlank() ? "stream" : sourceName;
    }
  }

  /**
   * In-memory lines.
   *
   * @param lines lines without terminators
   */
  record FromLines(List<String> lines) implements PipelineInput {
    public FromLines {
      lines = List.copyOf(lines);
    }
  }

  /**
   * In-memory records.
   *
   * @param records field maps in delivery order
   */
  record FromRecords(List<Map<String, Object>> records) implements PipelineInput {
    public FromRecords {
      records = List.copyOf(records);
    }
  }
}
