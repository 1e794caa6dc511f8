package ca.gc.cra.recstream.config;

import ca.gc.cra.recstream.domain.pipeline.PipelineSpec;
import ca.gc.cra.recstream.domain.pipeline.StageArg;
import ca.gc.cra.recstream.domain.pipeline.StageCall;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a pipeline definition for the command line.
 *
 * <pre>
 * stages:
 *   - name: grep
 *     args: ["$.status == 'ok'"]
 *   - name: sort
 *     args: [--key, "size=-numeric"]
 *   - totable
 * </pre>
 *
 * <p>An entry is either a stage name or a mapping with {@code name} and optional {@code args} (a list of
 * scalars or a single scalar). Only literal arguments can be expressed this way.</p>
 *
 * @since 0.1.0
 */
public final class PipelineDefinitionLoader {

  private PipelineDefinitionLoader() {}

  /**
   * Loads a definition file.
   *
   * @param path YAML file
   * @return pipeline
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a valid definition
   */
  public static PipelineSpec load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Parses a definition.
   *
   * @param reader YAML source; left open
   * @param sourceName label for error messages
   * @return pipeline
   * @throws IllegalArgumentException when the document is not a valid definition
   */
  public static PipelineSpec parse(Reader reader, String sourceName) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse pipeline definition " + sourceName, ex);
    }
    if (document == null) {
      return PipelineSpec.empty();
    }
    Map<String, Object> root = YamlConfigLoader.asMap(document, sourceName);
    Object stages = root.get("stages");
    if (stages == null) {
      return PipelineSpec.empty();
    }
    if (!(stages instanceof List<?> entries)) {
      throw new IllegalArgumentException(sourceName + ": stages must be a list");
    }
    List<StageCall> calls = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      calls.add(toCall(entries.get(i), sourceName + ": stages[" + i + "]"));
    }
    return PipelineSpec.of(calls);
  }

  private static StageCall toCall(Object entry, String context) {
    if (entry instanceof String name) {
      return new StageCall(requireName(name, context), List.of());
    }
    Map<String, Object> map = YamlConfigLoader.asMap(entry, context);
    Object name = map.get("name");
    if (!(name instanceof String text)) {
      throw new IllegalArgumentException(context + " needs a name");
    }
    List<StageArg> args = new ArrayList<>();
    Object raw = map.get("args");
    if (raw instanceof List<?> items) {
      for (Object item : items) {
        args.add(StageArg.literal(scalar(item, context)));
      }
    } else if (raw != null) {
      args.add(StageArg.literal(scalar(raw, context)));
    }
    return new StageCall(requireName(text, context), args);
  }

  private static String scalar(Object value, String context) {
    if (value == null || value instanceof Map<?, ?> || value instanceof List<?>) {
      throw new IllegalArgumentException(context + " args must be scalars");
    }
    return value.toString();
  }

  private static String requireName(String name, String context) {
    if (name.isBlank()) {
      throw new IllegalArgumentException(context + " has a blank name");
    }
    return name.trim();
  }
}
