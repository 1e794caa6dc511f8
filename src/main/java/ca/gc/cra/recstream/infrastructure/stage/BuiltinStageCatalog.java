package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.port.StageCatalog;
import ca.gc.cra.recstream.application.port.StageFactory;
import ca.gc.cra.recstream.infrastructure.json.JacksonRecordCodec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Case-insensitive catalog of the builtin stages.
 * <p><strong>Why:</strong> Gives the engine a usable set of record stages and lets embedders add their own
 * through {@link #with(String, StageFactory)}.</p>
 * <p><strong>Stages:</strong> {@code fromjson}, {@code grep}, {@code xform}, {@code eval}, {@code head},
 * {@code sort}, {@code topn}, {@code tojson}, {@code totable}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; factories create a fresh stage per call.</p>
 *
 * @since 0.1.0
 */
public final class BuiltinStageCatalog implements StageCatalog {
  private final Map<String, StageFactory> factories;

  private BuiltinStageCatalog(Map<String, StageFactory> factories) {
    this.factories = Collections.unmodifiableMap(factories);
  }

  /**
   * Creates the catalog of builtin stages.
   *
   * @param json codec used by {@code fromjson} to read JSON documents
   * @return catalog
   */
  public static BuiltinStageCatalog create(JacksonRecordCodec json) {
    Objects.requireNonNull(json, "json");
    Map<String, StageFactory> factories = new LinkedHashMap<>();
    factories.put("fromjson", (args, downstream, context) ->
        new FromJsonStage("fromjson", args, downstream, context, json));
    factories.put("grep", (args, downstream, context) -> new GrepStage("grep", args, downstream, context));
    factories.put("xform", (args, downstream, context) -> new XformStage("xform", args, downstream, context));
    factories.put("eval", (args, downstream, context) -> new EvalStage("eval", args, downstream, context));
    factories.put("head", (args, downstream, context) -> new HeadStage("head", args, downstream, context));
    factories.put("sort", (args, downstream, context) -> new SortStage("sort", args, downstream, context));
    factories.put("topn", (args, downstream, context) -> new TopnStage("topn", args, downstream, context));
    factories.put("tojson", (args, downstream, context) -> new ToJsonStage("tojson", args, downstream, context));
    factories.put("totable", (args, downstream, context) ->
        new ToTableStage("totable", args, downstream, context));
    return new BuiltinStageCatalog(factories);
  }

  /**
   * Returns a copy of this catalog with one more stage, replacing any stage of the same name.
   *
   * @param name stage name, matched case-insensitively
   * @param factory stage factory
   * @return new catalog
   */
  public BuiltinStageCatalog with(String name, StageFactory factory) {
    Objects.requireNonNull(factory, "factory");
    Map<String, StageFactory> copy = new LinkedHashMap<>(factories);
    copy.put(normalize(Objects.requireNonNull(name, "name")), factory);
    return new BuiltinStageCatalog(copy);
  }

  @Override
  public Optional<StageFactory> resolve(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(factories.get(normalize(name)));
  }

  @Override
  public Set<String> names() {
    return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
