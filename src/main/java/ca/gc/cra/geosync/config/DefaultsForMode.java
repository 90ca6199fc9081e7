package ca.gc.cra.geosync.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults of a command merged with the common defaults.
   *
   * @param mode command name ({@code sync})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "sync" -> buildSyncDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSyncDefaults() {
    SyncConfig defaults = SyncConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("backend", defaults.backend().name());
    map.put("dataDir", defaults.dataDir().toString());
    map.put("storeDir", defaults.storeDir().toString());
    map.put("srid", Integer.toString(defaults.srid()));
    map.put("polygonFile", "");
    map.put("polygonIdProperty", "id");
    map.put("polygonId", "");
    map.put("commitAttempts", Integer.toString(defaults.commitAttempts()));
    map.put("dryRun", "false");
    return map;
  }
}
