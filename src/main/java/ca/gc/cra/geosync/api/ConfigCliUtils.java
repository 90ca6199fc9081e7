package ca.gc.cra.geosync.api;

import java.util.Map;

/**
 * Helpers shared by commands that mix CLI flags with YAML settings.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /** Removes and returns the {@code config} (or {@code --config}) argument, or {@code null}. */
  static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
