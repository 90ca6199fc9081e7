package ca.gc.cra.geosync.application.pipeline;

import ca.gc.cra.geosync.domain.record.Table;

/**
 * Outcome of {@link SpatialFilterStage#apply}.
 *
 * @param accepted rows kept for reconciliation
 * @param corrected rows recovered by the coordinate swap
 * @param droppedInvalid rows still violating the axis convention after one swap
 * @param droppedOutside valid rows lying outside the region
 * @param withoutGeometry rows passed through without spatial checks
 * @param examined rows handed to the stage
 * @since 0.1.0
 */
public record SpatialFilterResult(
    Table accepted,
    int corrected,
    int droppedInvalid,
    int droppedOutside,
    int withoutGeometry,
    int examined) {}
