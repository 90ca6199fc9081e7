package ca.gc.cra.geosync.domain.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TableTest {

  @Test
  void schemaIsUnionOfDeclaredAndRowColumns() {
    Table table = Table.of(List.of("id"), List.of(
        Record.of(Map.of("id", 1, "a", "x")),
        Record.of(Map.of("id", 2, "b", "y"))));

    assertEquals(List.of("id", "a", "b"), table.columns());
    assertEquals(2, table.size());
  }

  @Test
  void emptyTableIsUndefinedButDeclaredTableIsNot() {
    assertTrue(Table.empty().isUndefined());
    Table declared = Table.of(List.of("id"), List.of());
    assertFalse(declared.isUndefined());
    assertTrue(declared.isEmpty());
  }

  @Test
  void keysAreNormalized() {
    Table table = Table.fromRows(List.of(
        Record.of(Map.of("id", "7")),
        Record.of(Map.of("id", 7.0)),
        Record.of(Map.of("name", "no key"))));

    assertEquals(List.of(7L, 7L, FieldValues.ABSENT), table.keys("id"));
  }

  @Test
  void withoutColumnsNarrowsSchemaAndRows() {
    Table table = Table.fromRows(List.of(Record.of(Map.of("id", 1, "secret", "s"))));

    Table narrowed = table.withoutColumns(List.of("secret", "missing"));

    assertEquals(List.of("id"), narrowed.columns());
    assertFalse(narrowed.row(0).has("secret"));
    assertSame(table, table.withoutColumns(List.of()));
  }

  @Test
  void filterKeepsSchema() {
    Table table = Table.fromRows(List.of(
        Record.of(Map.of("id", 1, "v", "a")),
        Record.of(Map.of("id", 2))));

    Table filtered = table.filter(row -> FieldValues.normalizeKey(row.get("id")).equals(2L));

    assertEquals(Set.of("id", "v"), Set.copyOf(filtered.columns()));
    assertEquals(1, filtered.size());
  }

  @Test
  void renameColumnsKeepsOrderAndRejectsCollisions() {
    Table table = Table.of(List.of("p1", "v", "w"), List.of(Record.of(Map.of("p1", 1, "v", "a", "w", "b"))));

    Table renamed = table.renameColumns(Map.of("p1", "id", "absent", "other"));

    assertEquals(List.of("id", "v", "w"), renamed.columns());
    assertEquals(1, renamed.row(0).get("id"));
    assertFalse(renamed.row(0).has("p1"));
    assertSame(table, table.renameColumns(Map.of()));
    assertThrows(IllegalArgumentException.class, () -> table.renameColumns(Map.of("v", "w")));
  }

  @Test
  void emptyColumnsAndBlankRowsAreRemoved() {
    Map<String, Object> blank = new HashMap<>();
    blank.put("id", null);
    blank.put("v", null);
    Table table = Table.of(List.of("id", "v", "unused"), List.of(
        Record.of(Map.of("id", 1)),
        Record.of(blank),
        Record.of(Map.of("id", 2, "v", "x"))));

    assertEquals(List.of("id", "v"), table.withoutEmptyColumns(List.of()).columns());
    assertEquals(List.of("id", "v", "unused"), table.withoutEmptyColumns(List.of("unused")).columns());
    assertEquals(List.of(1L, 2L), table.withoutBlankRows().keys("id"));
  }

  @Test
  void equalityIgnoresColumnOrder() {
    Record row = Record.of(Map.of("id", 1, "v", "a"));
    assertEquals(Table.of(List.of("id", "v"), List.of(row)), Table.of(List.of("v", "id"), List.of(row)));
  }
}
