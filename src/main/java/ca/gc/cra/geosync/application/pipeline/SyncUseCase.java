package ca.gc.cra.geosync.application.pipeline;

import ca.gc.cra.geosync.application.port.CommitResult;
import ca.gc.cra.geosync.application.port.GeoBackend;
import ca.gc.cra.geosync.application.port.MetricsPort;
import ca.gc.cra.geosync.application.port.RecordStore;
import ca.gc.cra.geosync.config.PolygonFilterConfig;
import ca.gc.cra.geosync.config.SourceConfig;
import ca.gc.cra.geosync.config.SyncConfig;
import ca.gc.cra.geosync.domain.error.ConfigurationException;
import ca.gc.cra.geosync.domain.error.SchemaException;
import ca.gc.cra.geosync.domain.error.StoreCommitException;
import ca.gc.cra.geosync.domain.error.SyncException;
import ca.gc.cra.geosync.domain.geo.GeoValidator;
import ca.gc.cra.geosync.domain.geo.PolygonFilter;
import ca.gc.cra.geosync.domain.geo.Region;
import ca.gc.cra.geosync.domain.reconcile.MergeMode;
import ca.gc.cra.geosync.domain.reconcile.ReconciliationEngine;
import ca.gc.cra.geosync.domain.reconcile.ReconciliationPlan;
import ca.gc.cra.geosync.domain.record.FieldValues;
import ca.gc.cra.geosync.domain.record.Table;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Synchronizes every unit of published files into the record store.
 * <p><strong>Why:</strong> Sources republish complete datasets per period; each run must fold them into
 * the store without duplicating rows and without letting one broken period block the others.</p>
 * <p><strong>Role:</strong> Application-layer use case wiring extraction, transforms, spatial filtering,
 * reconciliation, and commit.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the reference region once; an ambiguous region aborts the run.</li>
 *   <li>Treat each sub-directory of the data directory as a unit and process units in name order.</li>
 *   <li>Process spatial sources before related tables and restrict related tables to known keys; a unit
 *   without a spatial source is skipped.</li>
 *   <li>Retry a failed commit by reloading, reconciling again, and recommitting the whole batch.</li>
 *   <li>Isolate failures per unit and aggregate them into a {@link SyncReport}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; single-writer by contract.</p>
 * <p><strong>Observability:</strong> Emits {@code sync.*} metrics; sets MDC keys {@code sync.unit} and
 * {@code sync.source} while processing.</p>
 *
 * @since 0.1.0
 */
public final class SyncUseCase {
  private static final Logger log = LoggerFactory.getLogger(SyncUseCase.class);
  private static final Comparator<SourceFile> PROCESSING_ORDER = Comparator
      .comparing((SourceFile file) -> !file.source().isSpatial())
      .thenComparingInt(file -> file.source().order())
      .thenComparing(file -> file.path().getFileName().toString());

  private final SyncConfig config;
  private final GeoBackend backend;
  private final ReconciliationEngine engine;
  private final PolygonFilter polygonFilter;
  private final SourceTransformStage transformStage;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param config validated run configuration
   * @param backend backend family providing extraction, storage, and region lookup
   * @param engine reconciliation engine
   * @param metrics metrics sink
   */
  public SyncUseCase(SyncConfig config, GeoBackend backend, ReconciliationEngine engine, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.backend = Objects.requireNonNull(backend, "backend");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.polygonFilter = new PolygonFilter();
    this.transformStage = new SourceTransformStage(metrics);
  }

  /**
   * Runs the synchronization over every unit of the data directory.
   *
   * @return per-unit outcomes
   * @throws ConfigurationException when the configured region is missing or ambiguous
   * @throws IOException when the data directory or the polygon collection cannot be read
   */
  public SyncReport run() throws ConfigurationException, IOException {
    long started = System.nanoTime();
    Optional<Region> region = resolveRegion();
    List<Unit> units = discoverUnits(config.dataDir());
    log.info("Discovered {} units under {}", units.size(), config.dataDir());

    List<UnitResult> results = new ArrayList<>(units.size());
    for (Unit unit : units) {
      String previousUnit = MDC.get("sync.unit");
      MDC.put("sync.unit", unit.name());
      try {
        UnitResult result = processUnit(unit, region);
        metrics.increment("sync.unit." + result.status().name().toLowerCase(Locale.ROOT));
        results.add(result);
      } finally {
        if (previousUnit == null) {
          MDC.remove("sync.unit");
        } else {
          MDC.put("sync.unit", previousUnit);
        }
      }
    }

    SyncReport report = new SyncReport(results);
    metrics.observe("sync.run.durationMs", (System.nanoTime() - started) / 1_000_000L);
    log.info("Sync finished: {} units succeeded, {} failed, {} skipped; {} rows inserted, {} rows updated",
        report.succeeded(), report.failed(), report.skipped(), report.inserted(), report.updated());
    for (UnitResult failure : report.failures()) {
      log.warn("Unit {} failed after {} sources: {}",
          failure.unit(), failure.sources().size(), failure.error().orElse("unknown error"));
    }
    return report;
  }

  private Optional<Region> resolveRegion() throws ConfigurationException, IOException {
    Optional<PolygonFilterConfig> polygon = config.polygon();
    if (polygon.isEmpty()) {
      if (config.sources().stream().anyMatch(SourceConfig::isSpatial)) {
        log.info("No polygon configured; spatial sources are checked for axis order only");
      }
      return Optional.empty();
    }
    Region region = backend.polygonSource().get(polygon.get().polygonId());
    log.info("Filtering spatial sources by region {} from {}", region.id(), polygon.get().file().getFileName());
    return Optional.of(region);
  }

  private UnitResult processUnit(Unit unit, Optional<Region> region) {
    List<SourceFile> files = new ArrayList<>();
    for (Path path : unit.files()) {
      String baseName = baseName(path);
      Optional<SourceConfig> source = config.source(baseName);
      if (source.isEmpty()) {
        log.warn("No source configured for file {}; skipping", path.getFileName());
        continue;
      }
      if (!backend.extractor().supports(path)) {
        log.warn("Unsupported file format {}; skipping", path.getFileName());
        continue;
      }
      files.add(new SourceFile(source.get(), path));
    }
    if (files.isEmpty()) {
      log.info("Unit {} has no configured source files", unit.name());
      return UnitResult.skipped(unit.name(), "no configured source files");
    }
    files.sort(PROCESSING_ORDER);

    if (!files.get(0).source().isSpatial()) {
      log.info("Unit {} has no spatial source; related tables are not loaded on their own", unit.name());
      return UnitResult.skipped(unit.name(), "no spatial source");
    }

    Set<Object> processedKeys = new HashSet<>();
    List<SourceOutcome> outcomes = new ArrayList<>();
    for (SourceFile file : files) {
      String previousSource = MDC.get("sync.source");
      MDC.put("sync.source", file.source().name());
      try {
        outcomes.add(processSource(file, region, processedKeys));
      } catch (SyncException | IOException | UncheckedIOException ex) {
        log.warn("Unit {} failed on source {}: {}", unit.name(), file.source().name(), ex.getMessage());
        log.debug("Failure detail for unit {}", unit.name(), ex);
        return UnitResult.failed(unit.name(), outcomes,
            file.source().name() + ": " + ex.getClass().getSimpleName() + ": " + ex.getMessage());
      } finally {
        if (previousSource == null) {
          MDC.remove("sync.source");
        } else {
          MDC.put("sync.source", previousSource);
        }
      }
    }
    return UnitResult.succeeded(unit.name(), outcomes);
  }

  private SourceOutcome processSource(SourceFile file, Optional<Region> region, Set<Object> processedKeys)
      throws SyncException, IOException {
    SourceConfig source = file.source();
    String key = source.keyColumn();
    RecordStore store = backend.store();

    Table extracted = transformStage.apply(source, backend.extractor().extract(file.path()));
    metrics.observe("sync.records.extracted", extracted.size());
    if (!extracted.isEmpty() && !extracted.hasColumn(key)) {
      throw new SchemaException("file " + file.path().getFileName() + " has no key column '" + key + "'");
    }
    Table persisted = store.loadAll(source.table(), key);

    Table candidates = extracted;
    if (source.isSpatial()) {
      if (source.skipExisting()) {
        Set<Object> stored = new HashSet<>(persisted.keys(key));
        candidates = candidates.filter(row -> !stored.contains(FieldValues.normalizeKey(row.get(key))));
        log.debug("Skipped {} rows already stored in {}", extracted.size() - candidates.size(), source.table());
      }
      GeoValidator validator = new GeoValidator(source.coordinates().orElseThrow(), backend.pointFactory());
      SpatialFilterResult filtered =
          new SpatialFilterStage(validator, polygonFilter, region, metrics).apply(candidates);
      candidates = filtered.accepted();
      processedKeys.addAll(persisted.keys(key));
      processedKeys.addAll(candidates.keys(key));
    } else {
      candidates = candidates.filter(row -> processedKeys.contains(FieldValues.normalizeKey(row.get(key))));
      if (candidates.size() < extracted.size()) {
        log.debug("Dropped {} related rows with no accepted spatial record", extracted.size() - candidates.size());
      }
    }

    StoreCommitException lastFailure = null;
    for (int attempt = 1; attempt <= config.commitAttempts(); attempt++) {
      if (attempt > 1) {
        persisted = store.loadAll(source.table(), key);
      }
      ReconciliationPlan plan = engine.reconcile(persisted, candidates, key);
      log.info("Reconciled {} rows into {}: {} inserts, {} rows flagged, {} changed ({})",
          candidates.size(), source.table(), plan.insertSet().size(), plan.flaggedRows(),
          plan.changedRows(), plan.mode());
      if (attempt == 1 && plan.mode() == MergeMode.KEY_AND_OCCURRENCE) {
        log.warn("Key column {} repeats in {}; rows are paired by key and occurrence", key, source.table());
      }
      if (plan.isNoOp()) {
        return outcome(file, extracted, candidates, plan, false);
      }
      if (config.dryRun()) {
        log.info("Dry run: not committing {}", source.table());
        return outcome(file, extracted, candidates, plan, false);
      }
      try {
        CommitResult result = store.commit(source.table(), plan);
        metrics.increment("sync.commit.success");
        metrics.observe("sync.records.inserted", result.inserted());
        metrics.observe("sync.records.updated", plan.changedRows());
        log.debug("Committed {}: table now holds {} rows", result.table(), result.totalRows());
        return outcome(file, extracted, candidates, plan, true);
      } catch (StoreCommitException ex) {
        lastFailure = ex;
        metrics.increment("sync.commit.retry");
        log.warn("Commit attempt {}/{} for {} failed: {}",
            attempt, config.commitAttempts(), source.table(), ex.getMessage());
      }
    }
    metrics.increment("sync.commit.failed");
    throw Objects.requireNonNull(lastFailure, "lastFailure");
  }

  private static SourceOutcome outcome(
      SourceFile file, Table extracted, Table candidates, ReconciliationPlan plan, boolean committed) {
    return new SourceOutcome(
        file.source().name(),
        file.source().table(),
        extracted.size(),
        candidates.size(),
        committed ? plan.insertSet().size() : 0,
        plan.flaggedRows(),
        committed ? plan.changedRows() : 0,
        committed);
  }

  static List<Unit> discoverUnits(Path dataDir) throws IOException {
    List<Unit> units = new ArrayList<>();
    List<Path> rootFiles = listFiles(dataDir);
    if (!rootFiles.isEmpty()) {
      Path name = dataDir.getFileName();
      units.add(new Unit(name == null ? dataDir.toString() : name.toString(), rootFiles));
    }
    List<Path> directories;
    try (Stream<Path> entries = Files.list(dataDir)) {
      directories = entries
          .filter(Files::isDirectory)
          .filter(path -> !path.getFileName().toString().startsWith("."))
          .sorted()
          .toList();
    }
    for (Path directory : directories) {
      units.add(new Unit(directory.getFileName().toString(), listFiles(directory)));
    }
    return units;
  }

  private static List<Path> listFiles(Path directory) throws IOException {
    try (Stream<Path> entries = Files.list(directory)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(path -> !path.getFileName().toString().startsWith("."))
          .sorted()
          .toList();
    }
  }

  static String baseName(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  record Unit(String name, List<Path> files) {}

  private record SourceFile(SourceConfig source, Path path) {}
}
