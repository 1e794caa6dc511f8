package ca.gc.cra.recstream.application.pipeline;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a pipeline's final stage produces text (collected into a string) or records (collected into a
 * list) when the caller supplied no output writer.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface OutputPolicy {
  /** Name prefix that marks formatting stages such as {@code tojson} and {@code totable}. */
  String DEFAULT_TEXT_PREFIX = "to";

  /** Record-producing stages that happen to start with the text prefix. */
  Set<String> DEFAULT_RECORD_STAGES = Set.of("topn");

  /** Prefix {@code to}, excluding {@code topn}. */
  OutputPolicy DEFAULT = prefixed(DEFAULT_TEXT_PREFIX, DEFAULT_RECORD_STAGES);

  /**
   * Tests a stage name.
   *
   * @param stageName name of the last stage of a pipeline
   * @return {@code true} when the stage emits text lines
   */
  boolean isTextProducingStage(String stageName);

  /**
   * Builds the case-insensitive prefix rule.
   *
   * @param prefix text-stage prefix; must not be blank
   * @param recordStages names that start with the prefix but still produce records
   * @return policy
   */
  static OutputPolicy prefixed(String prefix, Set<String> recordStages) {
    Objects.requireNonNull(prefix, "prefix");
    if (prefix.isBlank()) {
      throw new IllegalArgumentException("prefix must not be blank");
    }
    String lowerPrefix = prefix.toLowerCase(Locale.ROOT);
    Set<String> exceptions = recordStages.stream()
        .map(name -> name.toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
    return stageName -> {
      if (stageName == null) {
        return false;
      }
      String lower = stageName.toLowerCase(Locale.ROOT);
      return lower.startsWith(lowerPrefix) && !exceptions.contains(lower);
    };
  }
}
