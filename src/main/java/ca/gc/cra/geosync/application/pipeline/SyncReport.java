package ca.gc.cra.geosync.application.pipeline;

import java.util.List;

/**
 * Aggregate outcome of a synchronization run.
 *
 * @param units per-unit results in processing order
 * @since 0.1.0
 */
public record SyncReport(List<UnitResult> units) {
  public SyncReport {
    units = List.copyOf(units);
  }

  public long succeeded() {
    return count(UnitResult.Status.SUCCEEDED);
  }

  public long failed() {
    return count(UnitResult.Status.FAILED);
  }

  public long skipped() {
    return count(UnitResult.Status.SKIPPED);
  }

  public int inserted() {
    return units.stream().mapToInt(UnitResult::inserted).sum();
  }

  public int updated() {
    return units.stream().mapToInt(UnitResult::updated).sum();
  }

  public List<UnitResult> failures() {
    return units.stream().filter(unit -> unit.status() == UnitResult.Status.FAILED).toList();
  }

  private long count(UnitResult.Status status) {
    return units.stream().filter(unit -> unit.status() == status).count();
  }
}
