package ca.gc.cra.geosync.application.pipeline;

import ca.gc.cra.geosync.application.port.MetricsPort;
import ca.gc.cra.geosync.config.DateFormatConfig;
import ca.gc.cra.geosync.config.SourceConfig;
import ca.gc.cra.geosync.domain.error.SchemaException;
import ca.gc.cra.geosync.domain.record.FieldValues;
import ca.gc.cra.geosync.domain.record.Record;
import ca.gc.cra.geosync.domain.record.Table;
import ca.gc.cra.geosync.logging.Logs;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Shapes an extracted table into the form it is stored in.
 * <p><strong>Role:</strong> Application stage run by {@link SyncUseCase} right after extraction, before the
 * key check and spatial filtering.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe to reuse.</p>
 *
 * <p>Order: drop columns without any value (key and coordinate columns excepted), drop rows without any
 * value, drop the configured columns, rename, rewrite date columns. Blank date values are left as they
 * are.</p>
 *
 * @since 0.1.0
 */
public final class SourceTransformStage {
  private static final Logger log = LoggerFactory.getLogger(SourceTransformStage.class);
  private static final int MAX_ECHO_BYTES = 64;

  private final MetricsPort metrics;

  public SourceTransformStage(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Applies the source's transforms.
   *
   * @param source source settings
   * @param extracted table as read from the file
   * @return transformed table
   * @throws SchemaException when renaming collides with a kept column or a date does not match its pattern
   */
  public Table apply(SourceConfig source, Table extracted) throws SchemaException {
    Objects.requireNonNull(source, "source");
    Table table = extracted.withoutEmptyColumns(source.structuralColumns());
    if (table.columns().size() < extracted.columns().size()) {
      log.debug("Dropped {} columns without values", extracted.columns().size() - table.columns().size());
    }
    int before = table.size();
    table = table.withoutBlankRows();
    if (table.size() < before) {
      metrics.observe("sync.records.droppedBlank", before - table.size());
      log.debug("Dropped {} rows without values", before - table.size());
    }
    table = table.withoutColumns(source.dropColumns());
    try {
      table = table.renameColumns(source.renameColumns());
    } catch (IllegalArgumentException ex) {
      throw new SchemaException("source " + source.name() + ": " + ex.getMessage(), ex);
    }
    if (source.dates().isPresent()) {
      table = reformatDates(table, source.dates().get());
    }
    return table;
  }

  private static Table reformatDates(Table table, DateFormatConfig dates) throws SchemaException {
    List<String> present = new ArrayList<>();
    for (String column : dates.columns()) {
      if (table.hasColumn(column)) {
        present.add(column);
      } else {
        log.debug("Date column {} not present; nothing to convert", column);
      }
    }
    if (present.isEmpty()) {
      return table;
    }
    DateTimeFormatter in = dates.inFormatter();
    DateTimeFormatter out = dates.outFormatter();
    List<Record> rows = new ArrayList<>(table.size());
    for (Record row : table.rows()) {
      Record converted = row;
      for (String column : present) {
        Object value = row.get(column);
        if (!FieldValues.isAbsent(value) && !value.toString().isBlank()) {
          converted = converted.withField(column, reformat(column, value, in, out, dates));
        }
      }
      rows.add(converted);
    }
    return table.withRows(rows);
  }

  private static String reformat(
      String column, Object value, DateTimeFormatter in, DateTimeFormatter out, DateFormatConfig dates)
      throws SchemaException {
    String text = value.toString().trim();
    try {
      TemporalAccessor parsed = in.parseBest(text, LocalDateTime::from, LocalDate::from);
      return out.format(parsed);
    } catch (DateTimeException ex) {
      throw new SchemaException("date column " + column + " holds '" + Logs.truncate(text, MAX_ECHO_BYTES)
          + "', which does not convert from " + dates.inFormat() + " to " + dates.outFormat(), ex);
    }
  }
}
