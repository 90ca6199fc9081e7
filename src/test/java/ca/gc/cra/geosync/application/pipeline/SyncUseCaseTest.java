package ca.gc.cra.geosync.application.pipeline;

import static ca.gc.cra.geosync.SyncFixtures.column;
import static ca.gc.cra.geosync.SyncFixtures.rectangle;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geosync.application.port.CommitResult;
import ca.gc.cra.geosync.application.port.GeoBackend;
import ca.gc.cra.geosync.application.port.PolygonSource;
import ca.gc.cra.geosync.application.port.RecordExtractor;
import ca.gc.cra.geosync.application.port.RecordStore;
import ca.gc.cra.geosync.config.BackendFamily;
import ca.gc.cra.geosync.config.DateFormatConfig;
import ca.gc.cra.geosync.config.PolygonFilterConfig;
import ca.gc.cra.geosync.config.SourceConfig;
import ca.gc.cra.geosync.config.SyncConfig;
import ca.gc.cra.geosync.domain.error.ConfigurationException;
import ca.gc.cra.geosync.domain.error.SchemaException;
import ca.gc.cra.geosync.domain.error.StoreCommitException;
import ca.gc.cra.geosync.domain.geo.CoordinateFields;
import ca.gc.cra.geosync.domain.geo.PointFactory;
import ca.gc.cra.geosync.domain.geo.Region;
import ca.gc.cra.geosync.domain.reconcile.ReconciliationEngine;
import ca.gc.cra.geosync.domain.reconcile.ReconciliationPlan;
import ca.gc.cra.geosync.domain.record.Table;
import ca.gc.cra.geosync.infrastructure.backend.InMemoryGeoBackend;
import ca.gc.cra.geosync.infrastructure.extract.NdjsonRecordExtractor;
import ca.gc.cra.geosync.infrastructure.geo.InMemoryPolygonSource;
import ca.gc.cra.geosync.infrastructure.geo.JtsPointFactory;
import ca.gc.cra.geosync.infrastructure.json.JsonSupport;
import ca.gc.cra.geosync.infrastructure.store.InMemoryRecordStore;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class SyncUseCaseTest {
  private static final Region REGION = rectangle("CZ010", -800_000, -1_100_000, -700_000, -1_000_000);
  private static final SourceConfig ACCIDENTS = new SourceConfig(
      "nehody", "accidents", "id", Optional.of(new CoordinateFields("x", "y")), 0, List.of(), false);
  private static final SourceConfig CARS = new SourceConfig(
      "cars", "vehicles", "id", Optional.empty(), 0, List.of("internal"), false);

  @TempDir
  Path dataDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private Logger useCaseLogger;
  private ListAppender<ILoggingEvent> appender;
  private boolean originalAdditive;

  @BeforeEach
  void attachAppender() {
    useCaseLogger = (Logger) LoggerFactory.getLogger(SyncUseCase.class);
    originalAdditive = useCaseLogger.isAdditive();
    appender = new ListAppender<>();
    appender.start();
    useCaseLogger.addAppender(appender);
    useCaseLogger.setAdditive(false);
  }

  @AfterEach
  void detachAppender() {
    useCaseLogger.detachAppender(appender);
    useCaseLogger.setAdditive(originalAdditive);
    appender.stop();
  }

  @Test
  void processesUnitsInOrderAndRestrictsRelatedTables() throws Exception {
    write("2023-01/nehody.ndjson",
        "{\"id\":1,\"x\":-742000.0,\"y\":-1043000.0,\"kind\":\"crash\"}",
        "{\"id\":2,\"x\":-1043500.0,\"y\":-742500.0,\"kind\":\"swapped\"}",
        "{\"id\":3,\"x\":-500000.0,\"y\":-1043000.0,\"kind\":\"outside\"}");
    write("2023-01/cars.ndjson",
        "{\"id\":1,\"vehicle\":\"car\",\"internal\":\"a\"}",
        "{\"id\":1,\"vehicle\":\"truck\",\"internal\":\"b\"}",
        "{\"id\":3,\"vehicle\":\"bike\",\"internal\":\"c\"}");
    write("2023-01/readme.txt", "not a source");
    write("2023-02/nehody.ndjson",
        "{\"id\":1,\"x\":-742000.0,\"y\":-1043000.0,\"kind\":\"crash-updated\"}",
        "{\"id\":4,\"x\":-750000.0,\"y\":-1050000.0,\"kind\":\"new\"}");
    InMemoryGeoBackend backend = memoryBackend(List.of(REGION));

    SyncReport report = useCase(config(3, false), backend).run();

    assertEquals(2, report.succeeded());
    assertEquals(0, report.failed());
    assertEquals(List.of("2023-01", "2023-02"), report.units().stream().map(UnitResult::unit).toList());
    assertEquals(5, report.inserted());
    assertEquals(1, report.updated());

    Table accidents = backend.store().loadAll("accidents", "id");
    assertEquals(List.of(1, 2, 4), column(accidents, "id"));
    assertEquals("crash-updated", accidents.row(0).get("kind"));
    assertEquals(-742500.0, accidents.row(1).get("x"));

    Table vehicles = backend.store().loadAll("vehicles", "id");
    assertEquals(List.of("car", "truck"), column(vehicles, "vehicle"));
    assertFalse(vehicles.hasColumn("internal"));

    assertEquals(List.of("nehody", "cars"),
        report.units().get(0).sources().stream().map(SourceOutcome::source).toList());
    assertEquals(2, metrics.count("sync.unit.succeeded"));
    assertEquals(3, metrics.count("sync.commit.success"));
    assertEquals(8, metrics.total("sync.records.extracted"));
  }

  @Test
  void secondRunOverSameDataCommitsNothing() throws Exception {
    write("2023-01/nehody.ndjson",
        "{\"id\":1,\"x\":-742000.0,\"y\":-1043000.0}",
        "{\"id\":2,\"x\":-1043500.0,\"y\":-742500.0}");
    write("2023-01/cars.ndjson", "{\"id\":1,\"vehicle\":\"car\"}", "{\"id\":1,\"vehicle\":\"van\"}");
    InMemoryGeoBackend backend = memoryBackend(List.of(REGION));
    SyncUseCase useCase = useCase(config(3, false), backend);

    useCase.run();
    Table accidents = backend.store().loadAll("accidents", "id");
    Table vehicles = backend.store().loadAll("vehicles", "id");
    int commits = metrics.count("sync.commit.success");
    SyncReport second = useCase.run();

    assertEquals(0, second.inserted());
    assertEquals(0, second.updated());
    assertEquals(commits, metrics.count("sync.commit.success"));
    assertEquals(accidents, backend.store().loadAll("accidents", "id"));
    assertEquals(vehicles, backend.store().loadAll("vehicles", "id"));
  }

  @Test
  void failingUnitDoesNotStopLaterUnits() throws Exception {
    write("a/nehody.ndjson", "{not json");
    write("b/nehody.ndjson", "{\"id\":7,\"x\":-742000.0,\"y\":-1043000.0}");
    InMemoryGeoBackend backend = memoryBackend(List.of(REGION));

    SyncReport report = useCase(config(3, false), backend).run();

    assertEquals(1, report.failed());
    assertEquals(1, report.succeeded());
    UnitResult failure = report.failures().get(0);
    assertEquals("a", failure.unit());
    assertTrue(failure.error().orElseThrow().startsWith("nehody: IOException"));
    assertEquals(List.of(7), column(backend.store().loadAll("accidents", "id"), "id"));
    assertEquals(1, metrics.count("sync.unit.failed"));

    ILoggingEvent warning = appender.list.stream()
        .filter(event -> event.getFormattedMessage().startsWith("Unit a failed on source nehody"))
        .findFirst()
        .orElseThrow();
    assertEquals("a", warning.getMDCPropertyMap().get("sync.unit"));
    assertEquals("nehody", warning.getMDCPropertyMap().get("sync.source"));
  }

  @Test
  void missingKeyColumnFailsOnlyThatUnit() throws Exception {
    write("a/nehody.ndjson", "{\"code\":1,\"x\":-742000.0,\"y\":-1043000.0}");
    InMemoryGeoBackend backend = memoryBackend(List.of(REGION));

    SyncReport report = useCase(config(3, false), backend).run();

    assertEquals(1, report.failed());
    assertTrue(report.failures().get(0).error().orElseThrow().contains(SchemaException.class.getSimpleName()));
  }

  @Test
  void commitIsRetriedAfterReload() throws Exception {
    write("u/nehody.ndjson", "{\"id\":1,\"x\":-742000.0,\"y\":-1043000.0}");
    FlakyStore store = new FlakyStore(2);

    SyncReport report = useCase(config(3, false), backend(store, List.of(REGION))).run();

    assertEquals(1, report.succeeded());
    assertEquals(2, metrics.count("sync.commit.retry"));
    assertEquals(1, metrics.count("sync.commit.success"));
    assertEquals(3, store.loads);
    assertEquals(1, store.delegate.loadAll("accidents", "id").size());
  }

  @Test
  void exhaustedRetriesFailTheUnit() throws Exception {
    write("u/nehody.ndjson", "{\"id\":1,\"x\":-742000.0,\"y\":-1043000.0}");
    FlakyStore store = new FlakyStore(5);

    SyncReport report = useCase(config(2, false), backend(store, List.of(REGION))).run();

    assertEquals(1, report.failed());
    assertEquals(1, metrics.count("sync.commit.failed"));
    assertTrue(store.delegate.loadAll("accidents", "id").isUndefined());
  }

  @Test
  void dryRunLeavesStoreUntouched() throws Exception {
    write("u/nehody.ndjson", "{\"id\":1,\"x\":-742000.0,\"y\":-1043000.0}");
    InMemoryGeoBackend backend = memoryBackend(List.of(REGION));

    SyncReport report = useCase(config(3, true), backend).run();

    assertEquals(1, report.succeeded());
    assertEquals(0, report.inserted());
    assertFalse(report.units().get(0).sources().get(0).committed());
    assertTrue(backend.store().loadAll("accidents", "id").isUndefined());
  }

  @Test
  void skipExistingIgnoresStoredKeys() throws Exception {
    SourceConfig skipping = new SourceConfig(
        "nehody", "accidents", "id", Optional.of(new CoordinateFields("x", "y")), 0, List.of(), true);
    write("a/nehody.ndjson", "{\"id\":1,\"x\":-742000.0,\"y\":-1043000.0,\"kind\":\"first\"}");
    write("b/nehody.ndjson", "{\"id\":1,\"x\":-742000.0,\"y\":-1043000.0,\"kind\":\"second\"}");
    InMemoryGeoBackend backend = memoryBackend(List.of(REGION));
    SyncConfig config = new SyncConfig(BackendFamily.MEMORY, dataDir, dataDir.resolve("store"), 5514,
        Optional.of(new PolygonFilterConfig(dataDir.resolve("regions.geojson"), "id", "CZ010")), 3, false,
        List.of(skipping));

    new SyncUseCase(config, backend, new ReconciliationEngine(), metrics).run();

    assertEquals("first", backend.store().loadAll("accidents", "id").row(0).get("kind"));
  }

  @Test
  void ambiguousRegionAbortsTheRun() throws Exception {
    write("u/nehody.ndjson", "{\"id\":1,\"x\":-742000.0,\"y\":-1043000.0}");
    Region twin = rectangle("CZ010", 0, 0, 1, 1);

    assertThrows(ConfigurationException.class,
        () -> useCase(config(3, false), memoryBackend(List.of(REGION, twin))).run());
    assertThrows(ConfigurationException.class,
        () -> useCase(config(3, false), memoryBackend(List.of())).run());
  }

  @Test
  void unitWithoutConfiguredFilesIsSkipped() throws Exception {
    write("u/other.ndjson", "{\"id\":1}");

    SyncReport report = useCase(config(3, false), memoryBackend(List.of(REGION))).run();

    assertEquals(1, report.skipped());
    assertEquals(1, metrics.count("sync.unit.skipped"));
  }

  @Test
  void unitWithoutSpatialSourceLeavesRelatedTablesUntouched() throws Exception {
    write("a/cars.ndjson", "{\"id\":1,\"vehicle\":\"car\"}", "{\"id\":9,\"vehicle\":\"bike\"}");
    write("b/nehody.ndjson", "{\"id\":1,\"x\":-742000.0,\"y\":-1043000.0}");
    write("b/cars.ndjson", "{\"id\":1,\"vehicle\":\"van\"}");
    InMemoryGeoBackend backend = memoryBackend(List.of(REGION));

    SyncReport report = useCase(config(3, false), backend).run();

    assertEquals(1, report.skipped());
    assertEquals(1, report.succeeded());
    UnitResult skipped = report.units().get(0);
    assertEquals("a", skipped.unit());
    assertEquals(UnitResult.Status.SKIPPED, skipped.status());
    assertTrue(skipped.sources().isEmpty());
    assertEquals(List.of("van"), column(backend.store().loadAll("vehicles", "id"), "vehicle"));
  }

  @Test
  void publishedColumnsAreRenamedAndDatesRewrittenBeforeReconciling() throws Exception {
    SourceConfig accidents = new SourceConfig("nehody", "accidents", "id",
        Optional.of(new CoordinateFields("x", "y")), 0, List.of("note"), Map.of("p1", "id"),
        Optional.of(new DateFormatConfig(List.of("day"), "dd.MM.yyyy", "yyyy-MM-dd")), false);
    write("a/nehody.ndjson",
        "{\"p1\":1,\"x\":-742000.0,\"y\":-1043000.0,\"day\":\"05.03.2023\",\"note\":\"n\",\"spare\":null}");
    write("b/nehody.ndjson",
        "{\"p1\":1,\"x\":-742000.0,\"y\":-1043000.0,\"day\":\"05.03.2023\",\"note\":\"m\",\"spare\":null}",
        "{}");
    InMemoryGeoBackend backend = memoryBackend(List.of(REGION));
    SyncConfig config = new SyncConfig(BackendFamily.MEMORY, dataDir, dataDir.resolve("store"), 5514,
        Optional.of(new PolygonFilterConfig(dataDir.resolve("regions.geojson"), "id", "CZ010")), 3, false,
        List.of(accidents));

    SyncReport report = new SyncUseCase(config, backend, new ReconciliationEngine(), metrics).run();

    assertEquals(2, report.succeeded());
    assertEquals(1, report.inserted());
    assertEquals(0, report.updated());
    Table stored = backend.store().loadAll("accidents", "id");
    assertEquals(Set.of("id", "x", "y", "day"), Set.copyOf(stored.columns()));
    assertEquals(List.of("2023-03-05"), column(stored, "day"));
  }

  @Test
  void discoverUnitsListsRootFilesThenSortedDirectories() throws IOException {
    write("loose.ndjson", "{}");
    write("b/x.ndjson", "{}");
    write("a/y.ndjson", "{}");
    Files.createDirectories(dataDir.resolve(".hidden"));

    List<SyncUseCase.Unit> units = SyncUseCase.discoverUnits(dataDir);

    assertEquals(List.of(dataDir.getFileName().toString(), "a", "b"),
        units.stream().map(SyncUseCase.Unit::name).toList());
    assertEquals("loose", SyncUseCase.baseName(units.get(0).files().get(0)));
  }

  private SyncConfig config(int attempts, boolean dryRun) {
    return new SyncConfig(BackendFamily.MEMORY, dataDir, dataDir.resolve("store"), 5514,
        Optional.of(new PolygonFilterConfig(dataDir.resolve("regions.geojson"), "id", "CZ010")),
        attempts, dryRun, List.of(ACCIDENTS, CARS));
  }

  private SyncUseCase useCase(SyncConfig config, GeoBackend backend) {
    return new SyncUseCase(config, backend, new ReconciliationEngine(), metrics);
  }

  private static InMemoryGeoBackend memoryBackend(List<Region> regions) {
    return new InMemoryGeoBackend(new JtsPointFactory(5514), new InMemoryPolygonSource(regions));
  }

  private static GeoBackend backend(RecordStore store, List<Region> regions) {
    JtsPointFactory points = new JtsPointFactory(5514);
    NdjsonRecordExtractor extractor = new NdjsonRecordExtractor(new JsonSupport());
    PolygonSource polygons = new InMemoryPolygonSource(regions);
    return new GeoBackend() {
      @Override
      public RecordExtractor extractor() {
        return extractor;
      }

      @Override
      public RecordStore store() {
        return store;
      }

      @Override
      public PolygonSource polygonSource() {
        return polygons;
      }

      @Override
      public PointFactory pointFactory() {
        return points;
      }
    };
  }

  private void write(String relative, String... lines) throws IOException {
    Path file = dataDir.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.write(file, List.of(lines), StandardCharsets.UTF_8);
  }

  /** Store whose first commits fail before anything is written. */
  private static final class FlakyStore implements RecordStore {
    private final InMemoryRecordStore delegate = new InMemoryRecordStore();
    private int failuresLeft;
    private int loads;

    private FlakyStore(int failures) {
      this.failuresLeft = failures;
    }

    @Override
    public Table loadAll(String table, String keyColumn) throws SchemaException {
      loads++;
      return delegate.loadAll(table, keyColumn);
    }

    @Override
    public CommitResult commit(String table, ReconciliationPlan plan) throws StoreCommitException {
      if (failuresLeft > 0) {
        failuresLeft--;
        throw new StoreCommitException("simulated commit failure");
      }
      return delegate.commit(table, plan);
    }
  }
}
