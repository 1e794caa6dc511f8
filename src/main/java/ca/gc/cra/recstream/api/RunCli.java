package ca.gc.cra.recstream.api;

import ca.gc.cra.recstream.application.pipeline.InputRequiredException;
import ca.gc.cra.recstream.application.pipeline.PipelineException;
import ca.gc.cra.recstream.application.pipeline.PipelineInput;
import ca.gc.cra.recstream.application.pipeline.PipelineResult;
import ca.gc.cra.recstream.application.pipeline.PipelineRunner;
import ca.gc.cra.recstream.application.pipeline.StageConfigurationException;
import ca.gc.cra.recstream.application.pipeline.UnknownStageException;
import ca.gc.cra.recstream.config.CompositionRoot;
import ca.gc.cra.recstream.config.PipelineDefinitionLoader;
import ca.gc.cra.recstream.config.RunnerConfig;
import ca.gc.cra.recstream.domain.pipeline.PipelineSpec;
import ca.gc.cra.recstream.domain.record.Record;
import ca.gc.cra.recstream.logging.LoggingConfigurator;
import ca.gc.cra.recstream.validation.Paths;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code recstream run}: runs a YAML pipeline definition over a file or standard input.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SUMMARY_USAGE =
      "usage: run pipeline=FILE [in=PATH] [out=PATH] [config=FILE] [textStagePrefix=to] "
          + "[recordStages=topn] [maxHostFunctions=N] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...] [--verbose]";
  private static final String HELP_TEXT = """
      recstream run

      Usage:
        run pipeline=./pipeline.yaml [in=./records.jsonl] [out=./result.txt] [options]

      Required:
        pipeline=FILE              YAML document with a 'stages' list

      Optional:
        in=PATH                    Input file (default: standard input, read only if the head stage wants input)
        out=PATH                   Output file (default: print text, or records as JSON lines)
        config=FILE                YAML configuration ('common' and 'run' sections)
        textStagePrefix=PREFIX     Final-stage prefix that marks text output (default to)
        recordStages=A,B           Prefixed stages that still produce records (default topn)
        maxHostFunctions=N         Host-function registry capacity (default 10000)
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private RunCli() {}

  /**
   * Executes the run command.
   *
   * @param args arguments after the command name
   * @return exit code
   */
  static ExitCode run(String[] args) {
    return run(args, System.in);
  }

  static ExitCode run(String[] args, InputStream stdin) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run CLI");
    }

    Map<String, String> effective;
    RunnerConfig config;
    Path pipelinePath;
    Path inPath;
    Path outPath;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig("run", kv, log);
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      config = RunnerConfig.fromMap(effective);
      pipelinePath = Paths.requireReadableFile("pipeline", effective.get("pipeline"));
      inPath = blank(effective.get("in")) ? null : Paths.requireReadableFile("in", effective.get("in"));
      outPath = blank(effective.get("out")) ? null : Paths.requireWritableFile("out", effective.get("out"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid run arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    PipelineSpec spec;
    try {
      spec = PipelineDefinitionLoader.load(pipelinePath);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid pipeline definition: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read pipeline definition {}", pipelinePath, ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(config);
        PipelineRunner runner = root.pipelineRunner()) {
      log.info("Running {} stage(s) from {} (input={}, output={})", spec.size(), pipelinePath,
          inPath == null ? PipelineInput.STDIN : inPath, outPath == null ? "stdout" : outPath);
      execute(root, runner, spec, inPath, outPath, stdin);
      log.info("Pipeline {} completed", pipelinePath);
      return ExitCode.SUCCESS;
    } catch (UnknownStageException | StageConfigurationException ex) {
      log.error("Pipeline rejected: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (InputRequiredException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (PipelineException ex) {
      log.error("Pipeline failed: {}", ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (IOException ex) {
      log.error("Pipeline I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void execute(
      CompositionRoot root,
      PipelineRunner runner,
      PipelineSpec spec,
      Path inPath,
      Path outPath,
      InputStream stdin) throws IOException {
    if (inPath != null) {
      try (BufferedReader reader = Files.newBufferedReader(inPath, StandardCharsets.UTF_8)) {
        emit(root, runner, spec, PipelineInput.fromStream(reader, inPath.toString()), outPath);
      }
    } else {
      emit(root, runner, spec, PipelineInput.fromStream(stdin), outPath);
    }
  }

  private static void emit(
      CompositionRoot root,
      PipelineRunner runner,
      PipelineSpec spec,
      PipelineInput input,
      Path outPath) throws IOException {
    if (outPath != null) {
      try (Writer writer = Files.newBufferedWriter(outPath, StandardCharsets.UTF_8)) {
        runner.run(spec, input, writer);
      }
      return;
    }
    PipelineResult result = runner.run(spec, input);
    if (result instanceof PipelineResult.Text text) {
      CliPrinter.print(text.text());
    } else {
      StringBuilder lines = new StringBuilder();
      for (Map<String, Object> record : result.records()) {
        lines.append(root.codec().encode(new Record(record))).append('\n');
      }
      CliPrinter.print(lines.toString());
    }
  }

  private static boolean blank(String value) {
    return value == null || value.isBlank();
  }
}
