package ca.gc.cra.recstream.application.pipeline;

import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a run returns, depending on the output policy.
 *
 * <ul>
 *   <li>{@link Streamed}: the caller's writer, after every line was written to it.</li>
 *   <li>{@link Text}: the concatenated lines of a text-producing final stage.</li>
 *   <li>{@link Records}: the records collected from any other final stage.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public sealed interface PipelineResult
    permits PipelineResult.Streamed, PipelineResult.Text, PipelineResult.Records {

  /**
   * Returns the text of a {@link Text} result.
   *
   * @return text
   * @throws IllegalStateException for other result kinds
   */
  default String text() {
    throw new IllegalStateException("Result is not text: " + getClass().getSimpleName());
  }

  /**
   * Returns the records of a {@link Records} result.
   *
   * @return records
   * @throws IllegalStateException for other result kinds
   */
  default List<Map<String, Object>> records() {
    throw new IllegalStateException("Result is not records: " + getClass().getSimpleName());
  }

  /**
   * Output streamed into the caller's writer.
   *
   * @param output writer supplied by the caller
   */
  record Streamed(Writer output) implements PipelineResult {
    public Streamed {
      Objects.requireNonNull(output, "output");
    }
  }

  /**
   * Text collected in memory; every line ends with {@code \n}.
   *
   * @param text collected text
   */
  record Text(String text) implements PipelineResult {
    public Text {
      Objects.requireNonNull(text, "text");
    }
  }

  /**
   * Records collected in memory, in arrival order.
   *
   * @param records plain field maps
   */
  record Records(List<Map<String, Object>> records) implements PipelineResult {
    public Records {
      records = List.copyOf(records);
    }
  }
}
