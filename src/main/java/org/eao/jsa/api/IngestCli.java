package org.eao.jsa.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.eao.jsa.application.ingest.IngestReport;
import org.eao.jsa.application.ingest.IngestUseCase;
import org.eao.jsa.application.ingest.SyncReport;
import org.eao.jsa.config.CompositionRoot;
import org.eao.jsa.config.ConfigMerger;
import org.eao.jsa.config.DefaultsForMode;
import org.eao.jsa.config.IngestConfig;
import org.eao.jsa.config.IngestMode;
import org.eao.jsa.config.YamlConfigLoader;
import org.eao.jsa.domain.error.IngestException;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.domain.error.ValidationException;
import org.eao.jsa.domain.model.Observation;
import org.eao.jsa.infrastructure.json.ObservationJsonWriter;
import org.eao.jsa.infrastructure.metrics.TelemetrySettings;
import org.eao.jsa.logging.LoggingConfigurator;
import org.eao.jsa.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code ingest} and {@code check} commands.
 *
 * @since 0.1.0
 */
public final class IngestCli {
  private static final Logger log = LoggerFactory.getLogger(IngestCli.class);
  private static final String SUMMARY_USAGE =
      "usage: <ingest|check> [config=PATH] [collection=JCMT|JCMTLS|JCMTUSER|SANDBOX] "
          + "[headers=DIR] [store=DIR] [out=DIR] [recipeInstanceMapping=PATH] [failFast=true|false] "
          + "[--dry-run] [--allow-remove] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      JCMT science archive ingestion

      Usage:
        ingest [options]    Aggregate headers and write observations to the store
        check [options]     Validate headers and report what would change (dry run by default)

      Options:
        config=PATH                  YAML file with common: and ingest:/check: sections
        collection=NAME              JCMT, JCMTLS, JCMTUSER or SANDBOX (default JCMT)
        headers=DIR                  Directory of per-file header JSON documents (default ./headers)
        store=DIR                    Directory of stored observations (default ./store)
        out=DIR                      Also write every written observation as JSON here
        recipeInstanceMapping=PATH   Run-id alias file: <alias-id> <job-id> [tag]
        failFast=true|false          Stop at the first observation that fails (default false)
        dryRun=true|false            Compute everything without writing (check defaults to true)
        metricsExporter=otlp|none    Metrics exporter (default otlp)
        otelEndpoint=URL             OTLP metrics endpoint
        otelResourceAttributes=K=V   Comma-separated OTel resource attributes
        --dry-run, -n                Same as dryRun=true
        --allow-remove               Allow observations to be removed when their last plane goes
        --verbose                    Enable DEBUG logging
        --help                       Show this message

      Notes:
        CLI values override YAML values, which override built-in defaults.
        In ingest mode any rejected file stops the batch before anything is written.
      """;

  private IngestCli() {}

  /**
   * Runs one command and returns its exit code without terminating the JVM.
   *
   * @param mode command to run
   * @param args command arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(IngestMode mode, String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", mode.key());
    }

    if (!input.unknownSwitches().isEmpty()) {
      log.error("Unknown option(s): {}", String.join(" ", input.unknownSwitches()));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.has(CliInput.Switch.DRY_RUN)) {
      cliKv.put("dryRun", "true");
    }
    if (input.has(CliInput.Switch.ALLOW_REMOVE)) {
      cliKv.put("allowRemove", "true");
    }
    String configPath = cliKv.remove("config");

    Optional<Map<String, String>> yaml;
    try {
      yaml = loadYaml(configPath, mode);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    Map<String, String> effective;
    IngestConfig config;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
      config = IngestConfig.fromMap(mode, effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode.key(), ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!input.verbose() && Boolean.parseBoolean(effective.get("verbose"))) {
      LoggingConfigurator.enableVerboseLogging();
    }

    log.info("Running {} for collection {} with headers={} store={} dryRun={} allowRemove={}",
        mode.key(), config.collection(), config.headers(), config.store(), config.dryRun(),
        config.allowRemove());
    try (CompositionRoot root = new CompositionRoot(config, TelemetrySettings.fromConfig(effective))) {
      return execute(root);
    }
  }

  private static ExitCode execute(CompositionRoot root) {
    IngestConfig config = root.config();
    IngestReport report;
    Optional<ObservationJsonWriter> batchWriter;
    try {
      batchWriter = root.batchWriter();
      IngestUseCase useCase = root.ingestUseCase();
      report = useCase.run(root.headerSource());
    } catch (ValidationException ex) {
      printProblems(ex.problems());
      return ExitCode.VALIDATION_FAILED;
    } catch (StoreException ex) {
      log.error("Record store failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IngestException ex) {
      log.error("Ingestion failed: {}", ex.getMessage(), ex);
      return ExitCode.PARTIAL_FAILURE;
    } catch (IOException ex) {
      log.error("Ingestion I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Ingestion configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }

    printReport(config, report);
    if (batchWriter.isPresent() && report.sync() != null && !config.dryRun()) {
      try {
        for (Observation observation : report.sync().written()) {
          Path file = batchWriter.get().write(observation);
          log.debug("Wrote {} to {}", observation.uri(), file);
        }
      } catch (IOException ex) {
        log.error("Failed to write batch output to {}", batchWriter.get().directory(), ex);
        return ExitCode.IO_ERROR;
      }
    }

    if (!report.rejected().isEmpty()) {
      return ExitCode.VALIDATION_FAILED;
    }
    if (!report.clean()) {
      return ExitCode.PARTIAL_FAILURE;
    }
    return ExitCode.SUCCESS;
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, IngestMode mode)
      throws IOException {
    if (configPath == null || configPath.isBlank()) {
      return Optional.empty();
    }
    Path path = Path.of(configPath.trim());
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("configuration file does not exist: " + path);
    }
    return YamlConfigLoader.load(path, mode);
  }

  private static void printProblems(List<String> problems) {
    CliPrinter.println("Batch rejected; nothing was written:");
    for (String problem : problems) {
      CliPrinter.println("  " + Logs.truncate(problem, 500));
    }
  }

  private static void printReport(IngestConfig config, IngestReport report) {
    CliPrinter.println((config.dryRun() ? "Dry run of " : "Ingestion of ") + config.collection()
        + ": " + report.filesRead() + " files read, " + report.rejected().size() + " rejected");
    report.rejected().forEach((fileId, problems) -> {
      CliPrinter.println("  rejected " + fileId);
      problems.forEach(problem -> CliPrinter.println("    " + Logs.truncate(problem, 500)));
    });
    SyncReport sync = report.sync();
    if (sync == null) {
      return;
    }
    sync.written().forEach(observation -> CliPrinter.println("  written " + observation.uri()));
    sync.wouldWrite().forEach(observation -> CliPrinter.println("  would write " + observation.uri()));
    sync.unchanged().forEach(uri -> CliPrinter.println("  unchanged " + uri));
    sync.removedPlanes().forEach((uri, planes) ->
        CliPrinter.println("  removed planes " + String.join(" ", planes) + " from " + uri));
    sync.removedObservations().forEach(uri -> CliPrinter.println("  removed " + uri));
    if (sync.supersededArtifacts() > 0) {
      CliPrinter.println("  superseded artifacts: " + sync.supersededArtifacts());
    }
    sync.failures().forEach((uri, message) ->
        CliPrinter.println("  failed " + uri + ": " + Logs.truncate(message, 500)));
  }
}
