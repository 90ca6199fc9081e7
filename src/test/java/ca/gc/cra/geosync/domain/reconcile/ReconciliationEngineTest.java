package ca.gc.cra.geosync.domain.reconcile;

import static ca.gc.cra.geosync.SyncFixtures.column;
import static ca.gc.cra.geosync.SyncFixtures.row;
import static ca.gc.cra.geosync.SyncFixtures.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geosync.domain.error.SchemaException;
import ca.gc.cra.geosync.domain.record.Record;
import ca.gc.cra.geosync.domain.record.Table;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReconciliationEngineTest {
  private final ReconciliationEngine engine = new ReconciliationEngine();

  @Test
  void classifiesUpdatesAndInserts() throws SchemaException {
    Table persisted = table(List.of("id", "name"), row("id", 1, "name", "A"), row("id", 2, "name", "B"));
    Table incoming = table(List.of("id", "name"), row("id", 2, "name", "B2"), row("id", 3, "name", "C"));

    ReconciliationPlan plan = engine.reconcile(persisted, incoming, "id");

    assertEquals(List.of(row("id", 2, "name", "B2")), plan.updateSet().rows());
    assertEquals(List.of(false, true), plan.updateMask());
    assertEquals(List.of(row("id", 3, "name", "C")), plan.insertSet().rows());
    assertEquals(List.of("A", "B2"), column(plan.mergedPersisted(), "name"));
    assertEquals(1, plan.changedRows());
    assertEquals(MergeMode.KEY_ONLY, plan.mode());
  }

  @Test
  void onlyMatchingOccurrenceIsUpdated() throws SchemaException {
    Table persisted = table(List.of("id", "seq", "v"),
        row("id", 1, "seq", 0, "v", "a"),
        row("id", 1, "seq", 1, "v", "b"));
    Table incoming = table(List.of("id", "v"), row("id", 1, "v", "a2"));

    ReconciliationPlan plan = engine.reconcile(persisted, incoming, "id");

    assertEquals(List.of("a2", "b"), column(plan.mergedPersisted(), "v"));
    assertEquals(List.of(true, true), plan.updateMask());
    assertEquals(1, plan.changedRows());
    assertTrue(plan.insertSet().isEmpty());
    assertEquals(MergeMode.KEY_AND_OCCURRENCE, plan.mode());
  }

  @Test
  void unmatchedOccurrenceIsPromotedToInsert() throws SchemaException {
    Table persisted = table(List.of("id", "v"), row("id", 5, "v", "x"));
    Table incoming = table(List.of("id", "v"), row("id", 5, "v", "y"), row("id", 5, "v", "z"));

    ReconciliationPlan plan = engine.reconcile(persisted, incoming, "id");

    assertEquals(List.of(row("id", 5, "v", "y")), plan.updateSet().rows());
    assertEquals(List.of(row("id", 5, "v", "z")), plan.insertSet().rows());
    assertEquals(List.of(true), plan.updateMask());
  }

  @Test
  void everyIncomingRowLandsInExactlyOneSet() throws SchemaException {
    Table persisted = table(List.of("id", "v"),
        row("id", 1, "v", "a"), row("id", 2, "v", "b"), row("id", 2, "v", "b'"), row("id", 4, "v", "d"));
    Table incoming = table(List.of("id", "v"),
        row("id", 2, "v", "b1"), row("id", 2, "v", "b2"), row("id", 2, "v", "b3"),
        row("id", 3, "v", "c"), row("id", "4", "v", "d"), row("id", 9, "v", "i"));

    ReconciliationPlan plan = engine.reconcile(persisted, incoming, "id");

    assertEquals(incoming.size(), plan.insertSet().size() + plan.updateSet().size());
    List<Object> seen = new ArrayList<>(column(plan.insertSet(), "v"));
    seen.addAll(column(plan.updateSet(), "v"));
    assertTrue(seen.containsAll(column(incoming, "v")));
    assertEquals(persisted.size(), plan.updateMask().size());
    assertEquals(List.of(false, true, true, true), plan.updateMask());
    assertEquals(List.of("b3", "c", "i"), column(plan.insertSet(), "v"));
  }

  @Test
  void secondRunOfSameBatchChangesNothing() throws SchemaException {
    Table persisted = table(List.of("id", "v"), row("id", 5, "v", "x"), row("id", 6, "v", "keep"));
    Table incoming = table(List.of("id", "v", "extra"),
        row("id", 5, "v", "y", "extra", 1), row("id", 5, "v", "z", "extra", 2), row("id", 7, "v", "n", "extra", 3));

    Table afterFirst = apply(persisted, engine.reconcile(persisted, incoming, "id"));
    ReconciliationPlan second = engine.reconcile(afterFirst, incoming, "id");
    Table afterSecond = apply(afterFirst, second);

    assertTrue(second.insertSet().isEmpty());
    assertEquals(0, second.changedRows());
    assertTrue(second.isNoOp());
    assertEquals(afterFirst, afterSecond);
    assertEquals(4, afterFirst.size());
  }

  @Test
  void absentIncomingValuesAreNoOp() throws SchemaException {
    Table persisted = table(List.of("id", "v"), row("id", 1, "v", "a"));
    Table incoming = table(List.of("id", "v"), row("id", 1.0, "v", Double.NaN));

    ReconciliationPlan plan = engine.reconcile(persisted, incoming, "id");

    assertEquals(List.of(true), plan.updateMask());
    assertTrue(plan.isNoOp());
  }

  @Test
  void emptyPersistedTableTurnsEverythingIntoInserts() throws SchemaException {
    Table incoming = table(List.of("id", "v"), row("id", 1, "v", "a"), row("id", 1, "v", "b"));

    ReconciliationPlan plan = engine.reconcile(Table.empty(), incoming, "id");

    assertEquals(2, plan.insertSet().size());
    assertTrue(plan.updateMask().isEmpty());
    assertEquals(List.of("id", "v"), plan.schema());
  }

  @Test
  void newIncomingColumnsExtendTheSchema() throws SchemaException {
    Table persisted = table(List.of("id", "a"), row("id", 1, "a", "x"));
    Table incoming = table(List.of("id", "a", "b"), row("id", 2, "a", "y", "b", "z"));

    ReconciliationPlan plan = engine.reconcile(persisted, incoming, "id");

    assertEquals(List.of("id", "a", "b"), plan.schema());
    assertEquals(List.of(false), plan.updateMask());
    assertTrue(plan.mergedPersisted().hasColumn("b"));
    assertFalse(plan.isNoOp());
  }

  @Test
  void missingKeyColumnIsSchemaError() {
    Table persisted = table(List.of("id", "v"), row("id", 1, "v", "a"));
    Table incoming = table(List.of("code", "v"), row("code", 1, "v", "a"));

    assertThrows(SchemaException.class, () -> engine.reconcile(persisted, incoming, "id"));
    assertThrows(SchemaException.class, () -> engine.reconcile(incoming, persisted, "id"));
  }

  @Test
  void rowWithoutKeyValueIsSchemaError() {
    Table incoming = table(List.of("id", "v"), row("id", 1, "v", "a"), row("id", " ", "v", "b"));

    assertThrows(SchemaException.class, () -> engine.reconcile(Table.empty(), incoming, "id"));
  }

  private static Table apply(Table persisted, ReconciliationPlan plan) {
    List<Record> next = new ArrayList<>();
    for (int i = 0; i < persisted.size(); i++) {
      next.add(plan.updateMask().get(i) ? plan.mergedPersisted().row(i) : persisted.row(i));
    }
    next.addAll(plan.insertSet().rows());
    return Table.of(plan.schema(), next).conformTo(plan.schema());
  }
}
