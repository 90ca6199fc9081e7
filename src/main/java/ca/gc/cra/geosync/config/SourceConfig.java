package ca.gc.cra.geosync.config;

import ca.gc.cra.geosync.domain.geo.CoordinateFields;
import ca.gc.cra.geosync.validation.Strings;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-source settings matched to published files by base name.
 *
 * <p>{@code dropColumns} and the keys of {@code renameColumns} use published column names; every other
 * column name (key, coordinates, dates) is the name after renaming.</p>
 *
 * @param name file base name without extension, e.g. {@code nehody}
 * @param table destination table in the record store
 * @param keyColumn primary key column used for reconciliation
 * @param coordinates coordinate fields; present only for spatial sources
 * @param order processing rank among sources of the same kind within a unit
 * @param dropColumns columns removed right after extraction
 * @param renameColumns published column name to stored column name
 * @param dates date columns rewritten from one pattern to another
 * @param skipExisting whether rows whose key is already stored are ignored
 * @since 0.1.0
 */
public record SourceConfig(
    String name,
    String table,
    String keyColumn,
    Optional<CoordinateFields> coordinates,
    int order,
    List<String> dropColumns,
    Map<String, String> renameColumns,
    Optional<DateFormatConfig> dates,
    boolean skipExisting) {

  public SourceConfig {
    name = Strings.requireNonBlank("source name", name);
    table = Strings.sanitizeIdentifier("table", table);
    keyColumn = Strings.requireNonBlank("keyColumn", keyColumn);
    coordinates = Objects.requireNonNullElse(coordinates, Optional.empty());
    dropColumns = List.copyOf(Objects.requireNonNullElse(dropColumns, List.of()));
    renameColumns = copyRenames(name, Objects.requireNonNullElse(renameColumns, Map.of()));
    dates = Objects.requireNonNullElse(dates, Optional.empty());
    if (dropColumns.contains(publishedName(renameColumns, keyColumn))) {
      throw new IllegalArgumentException("source " + name + " must not drop its key column " + keyColumn);
    }
  }

  /** Source without renamed or date columns. */
  public SourceConfig(
      String name,
      String table,
      String keyColumn,
      Optional<CoordinateFields> coordinates,
      int order,
      List<String> dropColumns,
      boolean skipExisting) {
    this(name, table, keyColumn, coordinates, order, dropColumns, Map.of(), Optional.empty(), skipExisting);
  }

  public boolean isSpatial() {
    return coordinates.isPresent();
  }

  /**
   * Columns that stay in the table even when every value is missing.
   *
   * @return key column plus coordinate columns
   */
  public Set<String> structuralColumns() {
    Set<String> columns = new HashSet<>();
    columns.add(keyColumn);
    coordinates.ifPresent(fields -> {
      columns.add(fields.x());
      columns.add(fields.y());
    });
    return columns;
  }

  private static String publishedName(Map<String, String> renames, String stored) {
    for (Map.Entry<String, String> entry : renames.entrySet()) {
      if (entry.getValue().equals(stored)) {
        return entry.getKey();
      }
    }
    return renames.containsKey(stored) ? "" : stored;
  }

  private static Map<String, String> copyRenames(String source, Map<String, String> renames) {
    Map<String, String> copy = new LinkedHashMap<>();
    Set<String> targets = new HashSet<>();
    for (Map.Entry<String, String> entry : renames.entrySet()) {
      String from = Strings.requireNonBlank("renameColumns key", entry.getKey());
      String to = Strings.requireNonBlank("renameColumns." + from, entry.getValue());
      if (!targets.add(to)) {
        throw new IllegalArgumentException("source " + source + " renames two columns to " + to);
      }
      copy.put(from, to);
    }
    return Collections.unmodifiableMap(copy);
  }
}
