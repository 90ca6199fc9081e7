package ca.gc.cra.geosync.domain.reconcile;

/**
 * How candidate rows are paired with persisted rows.
 *
 * @since 0.1.0
 */
public enum MergeMode {
  /** Keys are unique on both sides; rows pair by key. */
  KEY_ONLY,
  /** Keys repeat; rows pair by key and occurrence rank. */
  KEY_AND_OCCURRENCE
}
