package ca.gc.cra.geosync.config;

import ca.gc.cra.geosync.domain.geo.CoordinateFields;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the root-level {@code sources} list of a YAML configuration into {@link SourceConfig}s.
 *
 * <pre>{@code
 * sources:
 *   - name: nehody
 *     table: accidents
 *     keyColumn: id
 *     coordinates: { x: d, y: e }
 *     skipExisting: true
 *   - name: vozidla
 *     table: vehicles
 *     keyColumn: id
 *     order: 2
 *     dropColumns: [ p13a ]
 *     renameColumns: { p1: id }
 *     dates: { columns: [ p2a ], inFormat: "dd.MM.yyyy", outFormat: "yyyy-MM-dd" }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class SourceCatalogLoader {

  private SourceCatalogLoader() {}

  /**
   * Loads the source catalog.
   *
   * @param path YAML configuration file
   * @return sources in declaration order; empty when the document has no {@code sources} entry
   * @throws IOException when the file is missing or unreadable
   * @throws IllegalArgumentException when an entry is malformed
   */
  public static List<SourceConfig> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Configuration file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return List.of();
      }
      Map<String, Object> root = YamlConfigLoader.asMap(document, "root");
      Object sourcesNode = YamlConfigLoader.findSection(root, "sources");
      if (sourcesNode == null) {
        return List.of();
      }
      if (!(sourcesNode instanceof Iterable<?> entries)) {
        throw new IllegalArgumentException("sources must be a list");
      }
      List<SourceConfig> sources = new ArrayList<>();
      int index = 0;
      for (Object entry : entries) {
        sources.add(parseSource(YamlConfigLoader.asMap(entry, "sources[" + index + "]"), index));
        index++;
      }
      return List.copyOf(sources);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML sources at " + path, ex);
    }
  }

  private static SourceConfig parseSource(Map<String, Object> map, int index) {
    String name = requireString(map, "name", index);
    String table = optionalString(map.get("table")).orElse(name);
    String keyColumn = requireString(map, "keyColumn", index);
    int order = toInt(map.get("order"), "order", index);
    boolean skipExisting = toBoolean(map.get("skipExisting"));

    Optional<CoordinateFields> coordinates = Optional.empty();
    Object coordinatesNode = map.get("coordinates");
    if (coordinatesNode != null) {
      Map<String, Object> coords = YamlConfigLoader.asMap(coordinatesNode, "sources[" + index + "].coordinates");
      coordinates = Optional.of(new CoordinateFields(
          requireString(coords, "x", index), requireString(coords, "y", index)));
    }

    List<String> dropColumns = stringList(map.get("dropColumns"));

    Map<String, String> renameColumns = new LinkedHashMap<>();
    Object renameNode = map.get("renameColumns");
    if (renameNode != null) {
      Map<String, Object> renames = YamlConfigLoader.asMap(renameNode, "sources[" + index + "].renameColumns");
      for (Map.Entry<String, Object> entry : renames.entrySet()) {
        String target = optionalString(entry.getValue()).orElseThrow(() -> new IllegalArgumentException(
            "sources[" + index + "].renameColumns." + entry.getKey() + " is required"));
        renameColumns.put(entry.getKey(), target);
      }
    }

    Optional<DateFormatConfig> dates = Optional.empty();
    Object datesNode = map.get("dates");
    if (datesNode != null) {
      Map<String, Object> node = YamlConfigLoader.asMap(datesNode, "sources[" + index + "].dates");
      dates = Optional.of(new DateFormatConfig(
          stringList(node.get("columns")), requireString(node, "inFormat", index),
          requireString(node, "outFormat", index)));
    }

    return new SourceConfig(
        name, table, keyColumn, coordinates, order, dropColumns, renameColumns, dates, skipExisting);
  }

  private static List<String> stringList(Object node) {
    List<String> values = new ArrayList<>();
    if (node instanceof Iterable<?> iterable) {
      for (Object value : iterable) {
        optionalString(value).ifPresent(values::add);
      }
    } else if (node != null) {
      optionalString(node).ifPresent(values::add);
    }
    return values;
  }

  private static String requireString(Map<String, Object> map, String key, int index) {
    return optionalString(map.get(key)).orElseThrow(
        () -> new IllegalArgumentException("sources[" + index + "]." + key + " is required"));
  }

  private static Optional<String> optionalString(Object value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.toString().trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static int toInt(Object value, String key, int index) {
    if (value == null) {
      return 0;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("sources[" + index + "]." + key + " must be an integer", ex);
    }
  }

  private static boolean toBoolean(Object value) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    return value != null && Boolean.parseBoolean(value.toString().trim());
  }
}
