package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.pipeline.InvalidRecordException;
import ca.gc.cra.recstream.application.port.RecordReceiver;
import ca.gc.cra.recstream.application.port.StageContext;
import ca.gc.cra.recstream.domain.record.Record;
import ca.gc.cra.recstream.infrastructure.json.JacksonRecordCodec;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code fromjson [file...]}: turns JSON text into records.
 *
 * <p>Without arguments each input line may hold one or more JSON objects or arrays of objects. With file
 * arguments the stage generates its own input: it wants no pushed input and reads the files in order when
 * finished, stopping as soon as downstream asks. Inside a file, positions count records rather than lines.</p>
 *
 * @since 0.1.0
 */
final class FromJsonStage extends AbstractStage {
  private static final Logger log = LoggerFactory.getLogger(FromJsonStage.class);

  private final JacksonRecordCodec json;
  private final List<Path> files = new ArrayList<>();
  private boolean stopped;

  FromJsonStage(
      String name, List<String> args, RecordReceiver downstream, StageContext context, JacksonRecordCodec json) {
    super(name, downstream, context);
    this.json = json;
    StageArguments.parse(name, args, Set.of(), Set.of()).positional().forEach(file -> files.add(Path.of(file)));
  }

  @Override
  public boolean wantsInput() {
    return files.isEmpty();
  }

  @Override
  public boolean acceptLine(String line) {
    if (line.isBlank()) {
      return true;
    }
    read(new StringReader(line), context().position(), false);
    return !stopped;
  }

  @Override
  public boolean acceptRecord(Record record) {
    return pushRecord(record);
  }

  @Override
  protected void onFinish() {
    for (Path file : files) {
      if (stopped) {
        return;
      }
      context().beginSource(file.toString());
      log.debug("{} reading {}", name(), file);
      try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        read(reader, file.toString(), true);
      } catch (IOException ex) {
        throw new UncheckedIOException("Failed to read " + file, ex);
      }
    }
  }

  private void read(Reader reader, String sourceName, boolean countRecords) {
    try {
      json.readRecords(reader, sourceName, record -> {
        if (countRecords) {
          context().nextUnit();
        }
        if (!pushRecord(record)) {
          stopped = true;
        }
        return !stopped;
      });
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read " + sourceName, ex);
    } catch (IllegalArgumentException ex) {
      throw new InvalidRecordException(name(), context().position(), ex);
    }
  }
}
