package ca.gc.cra.geosync.config;

import ca.gc.cra.geosync.validation.Numbers;
import ca.gc.cra.geosync.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable, validated configuration for a synchronization run.
 * <p><strong>Why:</strong> Every component receives its settings through this record instead of ambient
 * globals, so a run is fully described by one value.</p>
 * <p><strong>Role:</strong> Configuration record built by the CLI and consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent reads.</p>
 *
 * @param backend backend family to wire
 * @param dataDir directory whose sub-directories are processed as units
 * @param storeDir directory holding table files for the {@code FILE} backend
 * @param srid spatial reference id of record coordinates and the region polygon
 * @param polygon reference region for spatial sources, when configured
 * @param commitAttempts how many times one batch is reconciled and committed before the unit fails
 * @param dryRun when {@code true}, plans are logged but never committed
 * @param sources source catalog
 * @since 0.1.0
 */
public record SyncConfig(
    BackendFamily backend,
    Path dataDir,
    Path storeDir,
    int srid,
    Optional<PolygonFilterConfig> polygon,
    int commitAttempts,
    boolean dryRun,
    List<SourceConfig> sources) {

  /** S-JTSK / Krovak East North. */
  public static final int DEFAULT_SRID = 5514;
  public static final int MAX_COMMIT_ATTEMPTS = 10;

  private static final Path DEFAULT_BASE = defaultBaseDirectory();

  public SyncConfig {
    backend = Objects.requireNonNullElse(backend, BackendFamily.FILE);
    dataDir = normalizePath("dataDir", dataDir);
    storeDir = normalizePath("storeDir", storeDir);
    Numbers.requireRange("srid", srid, 1, 999_999);
    polygon = Objects.requireNonNullElse(polygon, Optional.empty());
    Numbers.requireRange("commitAttempts", commitAttempts, 1, MAX_COMMIT_ATTEMPTS);
    sources = List.copyOf(Objects.requireNonNullElse(sources, List.of()));
    Set<String> names = new HashSet<>();
    for (SourceConfig source : sources) {
      if (!names.add(source.name())) {
        throw new IllegalArgumentException("duplicate source name: " + source.name());
      }
    }
  }

  /**
   * Provides default settings used when neither YAML nor CLI supply a value.
   *
   * @return default configuration without sources
   */
  public static SyncConfig defaults() {
    return new SyncConfig(
        BackendFamily.FILE,
        DEFAULT_BASE.resolve("data"),
        DEFAULT_BASE.resolve("store"),
        DEFAULT_SRID,
        Optional.empty(),
        3,
        false,
        List.of());
  }

  /**
   * Builds a configuration from flattened key/value settings and a source catalog.
   *
   * @param options merged settings (see {@link DefaultsForMode})
   * @param sources source catalog
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or the polygon settings are incomplete
   */
  public static SyncConfig fromMap(Map<String, String> options, List<SourceConfig> sources) {
    Objects.requireNonNull(options, "options");
    SyncConfig defaults = defaults();

    BackendFamily backend = BackendFamily.fromString(options.get("backend"));
    Path dataDir = optionalString(options.get("dataDir"))
        .map(value -> parsePath("dataDir", value))
        .orElse(defaults.dataDir());
    Path storeDir = optionalString(options.get("storeDir"))
        .map(value -> parsePath("storeDir", value))
        .orElse(defaults.storeDir());
    int srid = parseInt("srid", options.get("srid"), defaults.srid());
    int attempts = parseInt("commitAttempts", options.get("commitAttempts"), defaults.commitAttempts());
    boolean dryRun = parseBoolean(options.get("dryRun"), false);

    Optional<String> polygonFile = optionalString(options.get("polygonFile"));
    Optional<String> polygonId = optionalString(options.get("polygonId"));
    String idProperty = optionalString(options.get("polygonIdProperty")).orElse("id");
    Optional<PolygonFilterConfig> polygon = Optional.empty();
    if (polygonFile.isPresent() != polygonId.isPresent()) {
      throw new IllegalArgumentException("polygonFile and polygonId must be configured together");
    }
    if (polygonFile.isPresent()) {
      polygon = Optional.of(new PolygonFilterConfig(
          parsePath("polygonFile", polygonFile.get()), idProperty, polygonId.get()));
    }

    return new SyncConfig(backend, dataDir, storeDir, srid, polygon, attempts, dryRun, sources);
  }

  /**
   * Looks up a source by file base name.
   *
   * @param name base name
   * @return matching source
   */
  public Optional<SourceConfig> source(String name) {
    for (SourceConfig source : sources) {
      if (source.name().equals(name)) {
        return Optional.of(source);
      }
    }
    return Optional.empty();
  }

  private static int parseInt(String name, String value, int defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + value + "')", ex);
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path defaultBaseDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".geosync");
  }
}
