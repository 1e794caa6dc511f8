package ca.gc.cra.recstream.api;

import ca.gc.cra.recstream.config.CompositionRoot;
import ca.gc.cra.recstream.config.RunnerConfig;

/**
 * {@code recstream stages}: lists the stage names the builtin catalog resolves.
 *
 * @since 0.1.0
 */
public final class StagesCli {
  private StagesCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println("usage: stages");
      return ExitCode.SUCCESS;
    }
    try (CompositionRoot root = new CompositionRoot(RunnerConfig.defaults())) {
      root.catalog().names().forEach(CliPrinter::println);
    }
    return ExitCode.SUCCESS;
  }
}
