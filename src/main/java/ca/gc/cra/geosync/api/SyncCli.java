package ca.gc.cra.geosync.api;

import ca.gc.cra.geosync.application.pipeline.SyncReport;
import ca.gc.cra.geosync.application.pipeline.UnitResult;
import ca.gc.cra.geosync.application.port.GeoBackend;
import ca.gc.cra.geosync.config.BackendFamily;
import ca.gc.cra.geosync.config.CompositionRoot;
import ca.gc.cra.geosync.config.ConfigMerger;
import ca.gc.cra.geosync.config.DefaultsForMode;
import ca.gc.cra.geosync.config.SourceCatalogLoader;
import ca.gc.cra.geosync.config.SourceConfig;
import ca.gc.cra.geosync.config.SyncConfig;
import ca.gc.cra.geosync.config.YamlConfigLoader;
import ca.gc.cra.geosync.domain.error.ConfigurationException;
import ca.gc.cra.geosync.logging.LoggingConfigurator;
import ca.gc.cra.geosync.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code sync} command: folds every unit of the data directory into the record store.
 *
 * @since 0.1.0
 */
public final class SyncCli {
  private static final Logger log = LoggerFactory.getLogger(SyncCli.class);
  private static final String SUMMARY_USAGE =
      "usage: sync config=PATH [dataDir=PATH] [storeDir=PATH] [backend=file|memory] [srid=N] "
          + "[polygonFile=PATH polygonId=ID] [polygonIdProperty=NAME] [commitAttempts=N] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      geosync sync

      Usage:
        sync config=./geosync.yaml [options]

      Required:
        config=PATH                YAML file with common/sync sections and the sources catalog

      Optional (override YAML):
        dataDir=PATH               Directory whose sub-directories are processed as units
        storeDir=PATH              Table directory for backend=file
        backend=file|memory        Backend family (default file)
        srid=N                     Reference system of coordinates and polygon (default 5514)
        polygonFile=PATH           GeoJSON FeatureCollection of candidate regions
        polygonId=ID               Region to filter spatial sources by (requires polygonFile)
        polygonIdProperty=NAME     Feature property holding region ids (default id)
        commitAttempts=N           Reconcile-and-commit attempts per batch, 1..10 (default 3)
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Reconcile and log plans without committing
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private SyncCli() {}

  /**
   * Runs the command without terminating the JVM.
   *
   * @param args arguments following {@code sync}
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for sync CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArray());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath == null) {
      log.error("Missing required config=PATH");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.isRegularFile(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml;
    List<SourceConfig> sources;
    try {
      yaml = YamlConfigLoader.load(yamlPath, "sync");
      sources = SourceCatalogLoader.load(yamlPath);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      return ExitCode.IO_ERROR;
    }
    if (input.hasFlag("--dry-run")) {
      kv.put("dryRun", "true");
    }

    SyncConfig config;
    try {
      Map<String, String> effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig("sync", yaml, kv, DefaultsForMode.asFlatMap("sync"), log::warn));
      if (ConfigCliUtils.parseBoolean(effective, "verbose") && !input.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      TelemetryConfigurator.configureMetrics(effective);
      config = SyncConfig.fromMap(effective, sources);
      Paths.requireReadableDir("dataDir", config.dataDir());
      if (config.backend() == BackendFamily.FILE) {
        Paths.validateWritableDir("storeDir", config.storeDir(), !config.dryRun());
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid sync configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (sources.isEmpty()) {
      log.warn("Source catalog in {} is empty; every unit will be skipped", yamlPath);
    }

    log.info("Configured sync: backend={}, dataDir={}, storeDir={}, srid={}, polygon={}, dryRun={}",
        config.backend(), config.dataDir(), config.storeDir(), config.srid(),
        config.polygon().map(p -> p.polygonId() + "@" + p.file()).orElse("none"), config.dryRun());

    CompositionRoot root = new CompositionRoot(config);
    try (GeoBackend backend = root.backend()) {
      SyncReport report = root.syncUseCase(backend).run();
      printSummary(report, config.dryRun());
      return ExitCode.SUCCESS;
    } catch (ConfigurationException ex) {
      log.error("Region configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Sync I/O failure under {}", config.dataDir(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in sync", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in sync", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (root.metrics() instanceof AutoCloseable closeable) {
        closeQuietly(closeable);
      }
    }
  }

  private static void printSummary(SyncReport report, boolean dryRun) {
    CliPrinter.println(String.format(
        "%s: %d units succeeded, %d failed, %d skipped; %d rows inserted, %d rows updated",
        dryRun ? "Dry run" : "Sync",
        report.succeeded(), report.failed(), report.skipped(), report.inserted(), report.updated()));
    for (UnitResult failure : report.failures()) {
      CliPrinter.println("  failed " + failure.unit() + ": " + failure.error().orElse("unknown error"));
    }
  }

  private static void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception ex) {
      log.warn("Failed to close metrics adapter cleanly", ex);
    }
  }
}
