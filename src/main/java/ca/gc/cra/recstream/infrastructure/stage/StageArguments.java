package ca.gc.cra.recstream.infrastructure.stage;

import ca.gc.cra.recstream.application.pipeline.StageConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits a stage's textual arguments into boolean flags, valued options, and positional arguments.
 *
 * <p>Only the option names a stage declares are treated as options; any other token shaped like an option is
 * rejected, while tokens such as {@code -1 == $.x} stay positional.</p>
 */
final class StageArguments {
  private static final Pattern OPTION_SHAPE = Pattern.compile("--?[A-Za-z][A-Za-z0-9-]*");

  private final String stageName;
  private final Set<String> flags;
  private final Map<String, List<String>> options;
  private final List<String> positional;

  private StageArguments(
      String stageName, Set<String> flags, Map<String, List<String>> options, List<String> positional) {
    this.stageName = stageName;
    this.flags = flags;
    this.options = options;
    this.positional = positional;
  }

  static StageArguments parse(String stageName, List<String> args, Set<String> flagNames, Set<String> optionNames) {
    Set<String> flags = new HashSet<>();
    Map<String, List<String>> options = new LinkedHashMap<>();
    List<String> positional = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      String arg = args.get(i);
      if (flagNames.contains(arg)) {
        flags.add(arg);
      } else if (optionNames.contains(arg)) {
        if (i + 1 >= args.size()) {
          throw new StageConfigurationException(stageName, "option " + arg + " requires a value");
        }
        options.computeIfAbsent(arg, k -> new ArrayList<>()).add(args.get(++i));
      } else if (OPTION_SHAPE.matcher(arg).matches()) {
        throw new StageConfigurationException(stageName, "unknown option " + arg);
      } else {
        positional.add(arg);
      }
    }
    return new StageArguments(stageName, flags, options, Collections.unmodifiableList(positional));
  }

  boolean has(String flag) {
    return flags.contains(flag);
  }

  List<String> values(String option) {
    return options.getOrDefault(option, List.of());
  }

  Optional<String> value(String option) {
    List<String> values = values(option);
    if (values.size() > 1) {
      throw new StageConfigurationException(stageName, "option " + option + " given more than once");
    }
    return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
  }

  int nonNegativeInt(String option, int defaultValue) {
    Optional<String> text = value(option);
    if (text.isEmpty()) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(text.get().trim());
      if (parsed < 0) {
        throw new StageConfigurationException(stageName, option + " must not be negative: " + parsed);
      }
      return parsed;
    } catch (NumberFormatException ex) {
      throw new StageConfigurationException(stageName, option + " expects an integer: " + text.get(), ex);
    }
  }

  List<String> positional() {
    return positional;
  }

  String singleExpression() {
    if (positional.size() != 1) {
      throw new StageConfigurationException(stageName,
          "expects exactly one expression argument (got " + positional.size() + ")");
    }
    return positional.get(0);
  }

  void requireNoPositional() {
    if (!positional.isEmpty()) {
      throw new StageConfigurationException(stageName, "unexpected arguments " + positional);
    }
  }
}
