package ca.gc.cra.geosync.domain.record;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Ordered, immutable sequence of {@link Record}s plus the column schema they share.
 * <p><strong>Role:</strong> Batch type exchanged between extractors, the reconciliation engine, and stores.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * <p>The schema is the union of the declared columns and every field seen in the rows, in first-seen order.
 * Rows need not carry every column; a missing column reads as {@link FieldValues#ABSENT}.</p>
 *
 * @since 0.1.0
 */
public final class Table {
  private static final Table EMPTY = new Table(List.of(), List.of());

  private final List<String> columns;
  private final List<Record> rows;

  private Table(List<String> columns, List<Record> rows) {
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Returns the table with neither columns nor rows, standing for a table that does not exist yet.
   *
   * @return shared empty table
   */
  public static Table empty() {
    return EMPTY;
  }

  /**
   * Builds a table from declared columns and rows.
   *
   * @param columns declared columns in output order
   * @param rows rows in table order
   * @return new table
   */
  public static Table of(Collection<String> columns, List<Record> rows) {
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(rows, "rows");
    Set<String> schema = new LinkedHashSet<>(columns);
    for (Record row : rows) {
      schema.addAll(Objects.requireNonNull(row, "row").fieldNames());
    }
    return new Table(List.copyOf(schema), List.copyOf(rows));
  }

  /**
   * Builds a table whose schema is inferred from the rows.
   *
   * @param rows rows in table order
   * @return new table
   */
  public static Table fromRows(List<Record> rows) {
    return of(List.of(), rows);
  }

  public List<String> columns() {
    return columns;
  }

  public List<Record> rows() {
    return rows;
  }

  public Record row(int index) {
    return rows.get(index);
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * Returns whether the table has never been created: no declared columns and no rows.
   *
   * @return {@code true} for a table without schema
   */
  public boolean isUndefined() {
    return columns.isEmpty() && rows.isEmpty();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /**
   * Returns the normalized key of every row, in table order.
   *
   * @param keyColumn key column name
   * @return keys normalized with {@link FieldValues#normalizeKey(Object)}
   */
  public List<Object> keys(String keyColumn) {
    List<Object> keys = new ArrayList<>(rows.size());
    for (Record row : rows) {
      keys.add(FieldValues.normalizeKey(row.get(keyColumn)));
    }
    return Collections.unmodifiableList(keys);
  }

  /**
   * Keeps the rows matching {@code predicate}; the schema is preserved.
   *
   * @param predicate row filter
   * @return filtered table
   */
  public Table filter(Predicate<Record> predicate) {
    List<Record> kept = new ArrayList<>();
    for (Record row : rows) {
      if (predicate.test(row)) {
        kept.add(row);
      }
    }
    return new Table(columns, List.copyOf(kept));
  }

  /**
   * Removes columns from the schema and from every row.
   *
   * @param dropped columns to remove; unknown names are ignored
   * @return narrowed table
   */
  public Table withoutColumns(Collection<String> dropped) {
    if (dropped.isEmpty()) {
      return this;
    }
    List<String> kept = new ArrayList<>(columns);
    kept.removeAll(dropped);
    List<Record> narrowed = new ArrayList<>(rows.size());
    for (Record row : rows) {
      narrowed.add(row.without(dropped));
    }
    return new Table(List.copyOf(kept), List.copyOf(narrowed));
  }

  /**
   * Renames columns in the schema and in every row, keeping column order.
   *
   * @param renames old name to new name; names not present are ignored
   * @return renamed table
   * @throws IllegalArgumentException when a new name collides with a column that is kept
   */
  public Table renameColumns(Map<String, String> renames) {
    if (renames.isEmpty()) {
      return this;
    }
    Set<String> renamed = new LinkedHashSet<>();
    for (String column : columns) {
      String target = renames.getOrDefault(column, column);
      if (!renamed.add(target)) {
        throw new IllegalArgumentException("renaming produces duplicate column '" + target + "'");
      }
    }
    List<Record> moved = new ArrayList<>(rows.size());
    for (Record row : rows) {
      moved.add(row.renamed(renames));
    }
    return new Table(List.copyOf(renamed), List.copyOf(moved));
  }

  /**
   * Removes columns in which no row holds a value.
   *
   * @param kept columns to keep regardless of content
   * @return narrowed table
   */
  public Table withoutEmptyColumns(Collection<String> kept) {
    List<String> empty = new ArrayList<>();
    for (String column : columns) {
      if (kept.contains(column)) {
        continue;
      }
      boolean hasValue = false;
      for (Record row : rows) {
        if (!FieldValues.isAbsent(row.get(column))) {
          hasValue = true;
          break;
        }
      }
      if (!hasValue) {
        empty.add(column);
      }
    }
    return withoutColumns(empty);
  }

  /**
   * Removes rows that hold no value in any column.
   *
   * @return filtered table
   */
  public Table withoutBlankRows() {
    return filter(row -> !row.isBlank());
  }

  /**
   * Lays every row out on {@code schema}, filling missing columns with absent values.
   *
   * @param schema target column order; existing columns not listed are appended
   * @return conformed table
   */
  public Table conformTo(List<String> schema) {
    Set<String> merged = new LinkedHashSet<>(schema);
    merged.addAll(columns);
    List<String> target = List.copyOf(merged);
    List<Record> conformed = new ArrayList<>(rows.size());
    for (Record row : rows) {
      conformed.add(row.conformTo(target));
    }
    return new Table(target, List.copyOf(conformed));
  }

  /**
   * Returns a table with the same schema and the given rows.
   *
   * @param replacement rows to carry
   * @return new table sharing this schema
   */
  public Table withRows(List<Record> replacement) {
    return of(columns, replacement);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Table other)) {
      return false;
    }
    return new LinkedHashSet<>(columns).equals(new LinkedHashSet<>(other.columns)) && rows.equals(other.rows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Set.copyOf(columns), rows);
  }

  @Override
  public String toString() {
    return "Table{columns=" + columns + ", rows=" + rows.size() + "}";
  }
}
