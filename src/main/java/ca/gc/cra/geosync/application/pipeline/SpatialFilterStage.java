package ca.gc.cra.geosync.application.pipeline;

import ca.gc.cra.geosync.application.port.MetricsPort;
import ca.gc.cra.geosync.domain.error.SchemaException;
import ca.gc.cra.geosync.domain.geo.GeoValidator;
import ca.gc.cra.geosync.domain.geo.PolygonFilter;
import ca.gc.cra.geosync.domain.geo.Region;
import ca.gc.cra.geosync.domain.geo.ValidationResult;
import ca.gc.cra.geosync.domain.record.Record;
import ca.gc.cra.geosync.domain.record.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Validates and region-filters the rows of a spatial source.
 * <p><strong>Why:</strong> Published coordinates occasionally arrive with their axes exchanged; one swap
 * recovers them, anything still wrong afterwards lies outside the area of interest.</p>
 * <p><strong>Role:</strong> Application stage run by {@link SyncUseCase} before reconciliation.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per source.</p>
 * <p><strong>Observability:</strong> Emits {@code geo.*} counters and logs accepted and dropped counts.</p>
 *
 * <p>Order: validate, keep valid rows inside the region, swap the invalid rows once, re-validate them,
 * keep the corrected rows inside the region, drop the rest. Rows without a usable point skip spatial
 * checks and are passed through unchanged.</p>
 *
 * @since 0.1.0
 */
public final class SpatialFilterStage {
  private static final Logger log = LoggerFactory.getLogger(SpatialFilterStage.class);

  private final GeoValidator validator;
  private final PolygonFilter polygonFilter;
  private final Optional<Region> region;
  private final MetricsPort metrics;

  /**
   * Creates a stage.
   *
   * @param validator validator bound to the source's coordinate fields
   * @param polygonFilter region membership test
   * @param region reference region; when empty only the axis convention is enforced
   * @param metrics metrics sink
   */
  public SpatialFilterStage(
      GeoValidator validator, PolygonFilter polygonFilter, Optional<Region> region, MetricsPort metrics) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.polygonFilter = Objects.requireNonNull(polygonFilter, "polygonFilter");
    this.region = Objects.requireNonNull(region, "region");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs validation, correction, and region filtering.
   *
   * @param table extracted rows of a spatial source
   * @return accepted rows (with geometry attached) and counts
   * @throws SchemaException when the table lacks a coordinate column
   */
  public SpatialFilterResult apply(Table table) throws SchemaException {
    if (table.isEmpty()) {
      return new SpatialFilterResult(table, 0, 0, 0, 0, 0);
    }
    for (String column : List.of(validator.fields().x(), validator.fields().y())) {
      if (!table.hasColumn(column)) {
        throw new SchemaException("spatial source has no coordinate column '" + column + "'");
      }
    }

    Table located = validator.attachGeometry(table);
    ValidationResult first = validator.validate(located.rows());
    List<Record> accepted = new ArrayList<>(inRegion(first.valid()));
    int outside = first.valid().size() - accepted.size();

    int corrected = 0;
    int invalid = 0;
    if (first.hasInvalid()) {
      ValidationResult second = validator.validate(validator.swap(first.invalid()));
      List<Record> recovered = inRegion(second.valid());
      corrected = recovered.size();
      outside += second.valid().size() - recovered.size();
      invalid = second.invalid().size();
      accepted.addAll(recovered);
    }

    List<Record> unlocated = new ArrayList<>();
    for (Record row : located.rows()) {
      if (!row.hasGeometry()) {
        unlocated.add(row);
      }
    }
    accepted.addAll(unlocated);

    metrics.observe("geo.records.accepted", accepted.size());
    if (corrected > 0) {
      metrics.observe("geo.records.swapped", corrected);
    }
    if (invalid > 0) {
      metrics.observe("geo.records.droppedInvalid", invalid);
      log.warn("Dropped {} records still violating the axis convention after one swap", invalid);
    }
    if (outside > 0) {
      metrics.observe("geo.records.droppedOutside", outside);
      log.info("Dropped {} records outside region {}", outside, region.map(Region::id).orElse("<none>"));
    }
    if (!unlocated.isEmpty()) {
      log.debug("{} records carry no coordinates and skip spatial checks", unlocated.size());
    }
    log.debug("Spatial filter accepted {} of {} records ({} corrected by swap)",
        accepted.size(), table.size(), corrected);

    return new SpatialFilterResult(
        located.withRows(accepted), corrected, invalid, outside, unlocated.size(), table.size());
  }

  private List<Record> inRegion(List<Record> records) {
    if (region.isEmpty()) {
      return records;
    }
    return polygonFilter.intersect(records, region.get());
  }
}
