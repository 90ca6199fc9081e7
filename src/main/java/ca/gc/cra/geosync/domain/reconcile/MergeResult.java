package ca.gc.cra.geosync.domain.reconcile;

import ca.gc.cra.geosync.domain.record.Table;
import java.util.List;

/**
 * Output of {@link ColumnMerger#merge}.
 *
 * @param merged persisted rows with candidate values applied, aligned one-to-one with the persisted table
 * @param unmatchedCandidates candidate positions that found no persisted occurrence to update
 * @param mode pairing mode that was used
 * @param partition column split that drove the merge
 * @param duplicatedCandidateKeys number of keys repeated among the candidates
 * @since 0.1.0
 */
public record MergeResult(
    Table merged,
    List<Integer> unmatchedCandidates,
    MergeMode mode,
    ColumnPartition partition,
    int duplicatedCandidateKeys) {
  public MergeResult {
    unmatchedCandidates = List.copyOf(unmatchedCandidates);
  }
}
