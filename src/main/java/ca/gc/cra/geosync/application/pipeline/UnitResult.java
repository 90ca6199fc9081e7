package ca.gc.cra.geosync.application.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one unit (a directory of published files).
 *
 * @param unit unit name
 * @param status final status
 * @param sources per-source counts, in processing order
 * @param error failure description when {@code status} is {@link Status#FAILED}
 * @since 0.1.0
 */
public record UnitResult(String unit, Status status, List<SourceOutcome> sources, Optional<String> error) {

  /** Unit status. */
  public enum Status {
    SUCCEEDED,
    FAILED,
    SKIPPED
  }

  public UnitResult {
    Objects.requireNonNull(unit, "unit");
    Objects.requireNonNull(status, "status");
    sources = List.copyOf(sources);
    error = Objects.requireNonNullElse(error, Optional.empty());
  }

  static UnitResult succeeded(String unit, List<SourceOutcome> sources) {
    return new UnitResult(unit, Status.SUCCEEDED, sources, Optional.empty());
  }

  static UnitResult skipped(String unit, String reason) {
    return new UnitResult(unit, Status.SKIPPED, List.of(), Optional.of(reason));
  }

  static UnitResult failed(String unit, List<SourceOutcome> sources, String error) {
    return new UnitResult(unit, Status.FAILED, sources, Optional.of(error));
  }

  public int inserted() {
    return sources.stream().mapToInt(SourceOutcome::inserted).sum();
  }

  public int updated() {
    return sources.stream().mapToInt(SourceOutcome::changed).sum();
  }
}
