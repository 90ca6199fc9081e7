package ca.gc.cra.geosync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geosync.domain.geo.CoordinateFields;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SyncConfigTest {
  private static final SourceConfig ACCIDENTS = new SourceConfig(
      "nehody", "accidents", "p1", Optional.of(new CoordinateFields("d", "e")), 0, List.of(), false);

  @TempDir Path tempDir;

  @Test
  void fromMapParsesEverySetting() {
    Map<String, String> options = new HashMap<>();
    options.put("backend", "memory");
    options.put("dataDir", tempDir.resolve("data").toString());
    options.put("storeDir", tempDir.resolve("store/../tables").toString());
    options.put("srid", "4326");
    options.put("commitAttempts", "4");
    options.put("dryRun", "TRUE");
    options.put("polygonFile", tempDir.resolve("kraje.geojson").toString());
    options.put("polygonIdProperty", "KOD_CZNUTS");
    options.put("polygonId", "CZ010");

    SyncConfig config = SyncConfig.fromMap(options, List.of(ACCIDENTS));

    assertEquals(BackendFamily.MEMORY, config.backend());
    assertEquals(tempDir.resolve("tables").toAbsolutePath().normalize(), config.storeDir());
    assertEquals(4326, config.srid());
    assertEquals(4, config.commitAttempts());
    assertTrue(config.dryRun());
    PolygonFilterConfig polygon = config.polygon().orElseThrow();
    assertEquals("KOD_CZNUTS", polygon.idProperty());
    assertEquals("CZ010", polygon.polygonId());
    assertEquals(Optional.of(ACCIDENTS), config.source("nehody"));
    assertEquals(Optional.empty(), config.source("vozidla"));
  }

  @Test
  void blankValuesFallBackToDefaults() {
    SyncConfig config = SyncConfig.fromMap(Map.of("srid", " ", "polygonFile", ""), List.of());
    SyncConfig defaults = SyncConfig.defaults();

    assertEquals(BackendFamily.FILE, config.backend());
    assertEquals(defaults.dataDir(), config.dataDir());
    assertEquals(SyncConfig.DEFAULT_SRID, config.srid());
    assertFalse(config.polygon().isPresent());
    assertFalse(config.dryRun());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(Map.of("srid", "abc"), List.of()));
    assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(Map.of("commitAttempts", "0"), List.of()));
    assertThrows(IllegalArgumentException.class,
        () -> SyncConfig.fromMap(Map.of("commitAttempts", "11"), List.of()));
    assertThrows(IllegalArgumentException.class, () -> SyncConfig.fromMap(Map.of("polygonId", "CZ010"), List.of()));
  }

  @Test
  void duplicateSourceNamesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> SyncConfig.fromMap(Map.of(), List.of(ACCIDENTS, ACCIDENTS)));
  }

  @Test
  void sourceMayNotDropItsKeyOrUsePathTables() {
    assertThrows(IllegalArgumentException.class, () -> new SourceConfig(
        "vozidla", "vehicles", "p1", Optional.empty(), 0, List.of("p1"), false));
    assertThrows(IllegalArgumentException.class, () -> new SourceConfig(
        "vozidla", "../vehicles", "p1", Optional.empty(), 0, List.of(), false));
  }

  @Test
  void keyDropCheckFollowsRenamedColumns() {
    assertThrows(IllegalArgumentException.class, () -> new SourceConfig("vozidla", "vehicles", "id",
        Optional.empty(), 0, List.of("p1"), Map.of("p1", "id"), Optional.empty(), false));

    SourceConfig replaced = new SourceConfig("vozidla", "vehicles", "id",
        Optional.empty(), 0, List.of("id"), Map.of("p1", "id"), Optional.empty(), false);
    assertEquals(List.of("id"), replaced.dropColumns());
  }
}
