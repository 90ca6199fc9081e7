package ca.gc.cra.geosync.infrastructure.store;

import ca.gc.cra.geosync.application.port.CommitResult;
import ca.gc.cra.geosync.application.port.RecordStore;
import ca.gc.cra.geosync.domain.error.SchemaException;
import ca.gc.cra.geosync.domain.error.StoreCommitException;
import ca.gc.cra.geosync.domain.reconcile.ReconciliationPlan;
import ca.gc.cra.geosync.domain.record.FieldValues;
import ca.gc.cra.geosync.domain.record.Record;
import ca.gc.cra.geosync.domain.record.Table;
import ca.gc.cra.geosync.infrastructure.json.JsonSupport;
import ca.gc.cra.geosync.validation.Strings;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Record store keeping one JSON document per table in a directory.
 * <p><strong>Role:</strong> {@link RecordStore} adapter for the {@code FILE} backend family.</p>
 * <p><strong>Thread-safety:</strong> Single-writer; concurrent commits to the same table are not supported.</p>
 *
 * <p>A commit writes the complete next state to a temporary file in the same directory and moves it over the
 * table file with {@link StandardCopyOption#ATOMIC_MOVE}, so readers see either the old or the new table.
 * Point geometry is stored as WKT; absent values as JSON {@code null}.</p>
 *
 * <pre>{@code
 * {"table":"accidents","srid":5514,"columns":["id","d","e"],
 *  "rows":[{"fields":{"id":1,"d":-742000.5,"e":-1043000.0},"geometry":"POINT (-742000.5 -1043000)"}]}
 * }</pre>
 *
 * @since 0.1.0
 */
public final class JsonFileRecordStore implements RecordStore {
  private static final Logger log = LoggerFactory.getLogger(JsonFileRecordStore.class);

  private final Path directory;
  private final JsonSupport json;
  private final GeometryFactory geometryFactory;

  /**
   * Creates a store rooted at {@code directory}; the directory is created on first commit.
   *
   * @param directory directory holding table files
   * @param json JSON helper
   * @param geometryFactory factory carrying the SRID of stored points
   */
  public JsonFileRecordStore(Path directory, JsonSupport json, GeometryFactory geometryFactory) {
    this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
    this.json = Objects.requireNonNull(json, "json");
    this.geometryFactory = Objects.requireNonNull(geometryFactory, "geometryFactory");
  }

  @Override
  public Table loadAll(String table, String keyColumn) throws IOException, SchemaException {
    Path file = tableFile(table);
    if (!Files.exists(file)) {
      return Table.empty();
    }
    Table loaded = read(file);
    if (!loaded.isUndefined() && !loaded.hasColumn(keyColumn)) {
      throw new SchemaException("stored table " + table + " has no key column '" + keyColumn + "'");
    }
    return loaded;
  }

  @Override
  public CommitResult commit(String table, ReconciliationPlan plan) throws StoreCommitException {
    Objects.requireNonNull(plan, "plan");
    Path file = tableFile(table);
    Table current;
    try {
      current = Files.exists(file) ? read(file) : Table.empty();
    } catch (IOException ex) {
      throw new StoreCommitException("unable to read " + file + " before commit", ex);
    }
    Table next = TableCommits.apply(table, current, plan);

    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, "." + table + ".", ".tmp");
      write(temp, table, next);
      Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      temp = null;
    } catch (IOException ex) {
      throw new StoreCommitException("unable to commit " + table + " to " + file, ex);
    } finally {
      if (temp != null) {
        deleteQuietly(temp);
      }
    }
    log.debug("Committed {} inserts and {} updates to {}", plan.insertSet().size(), plan.flaggedRows(), file);
    return new CommitResult(table, plan.insertSet().size(), plan.flaggedRows(), next.size());
  }

  Path tableFile(String table) {
    return directory.resolve(Strings.sanitizeIdentifier("table", table) + ".json");
  }

  private Table read(Path file) throws IOException {
    Object document;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      document = json.parse(reader);
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IOException("table file " + file + " must hold a JSON object");
    }
    List<String> columns = new ArrayList<>();
    if (root.get("columns") instanceof List<?> names) {
      for (Object name : names) {
        columns.add(String.valueOf(name));
      }
    }
    List<Record> rows = new ArrayList<>();
    if (root.get("rows") instanceof List<?> entries) {
      WKTReader wkt = new WKTReader(geometryFactory);
      for (Object entry : entries) {
        if (!(entry instanceof Map<?, ?> row)) {
          throw new IOException("table file " + file + " contains a malformed row");
        }
        rows.add(readRow(file, row, wkt));
      }
    }
    return Table.of(columns, rows);
  }

  private Record readRow(Path file, Map<?, ?> row, WKTReader wkt) throws IOException {
    Map<String, Object> fields = new LinkedHashMap<>();
    if (row.get("fields") instanceof Map<?, ?> values) {
      for (Map.Entry<?, ?> entry : values.entrySet()) {
        fields.put(String.valueOf(entry.getKey()), entry.getValue());
      }
    }
    Point point = null;
    if (row.get("geometry") instanceof String text && !text.isBlank()) {
      try {
        Geometry geometry = wkt.read(text);
        if (!(geometry instanceof Point p)) {
          throw new IOException("table file " + file + " holds non-point geometry " + geometry.getGeometryType());
        }
        point = p;
      } catch (ParseException ex) {
        throw new IOException("table file " + file + " holds invalid WKT: " + text, ex);
      }
    }
    return Record.of(fields, point);
  }

  private void write(Path target, String table, Table next) throws IOException {
    WKTWriter wkt = new WKTWriter();
    try (JsonGenerator generator = json.factory().createGenerator(target.toFile(), JsonEncoding.UTF8)) {
      generator.writeStartObject();
      generator.writeStringField("table", table);
      generator.writeNumberField("srid", geometryFactory.getSRID());
      generator.writeArrayFieldStart("columns");
      for (String column : next.columns()) {
        generator.writeString(column);
      }
      generator.writeEndArray();
      generator.writeArrayFieldStart("rows");
      for (Record row : next.rows()) {
        generator.writeStartObject();
        generator.writeObjectFieldStart("fields");
        for (Map.Entry<String, Object> field : row.fields().entrySet()) {
          generator.writeFieldName(field.getKey());
          Object value = field.getValue();
          JsonSupport.writeScalar(generator, FieldValues.isAbsent(value) ? null : value);
        }
        generator.writeEndObject();
        if (row.hasGeometry()) {
          generator.writeStringField("geometry", wkt.write(row.geometry().orElseThrow()));
        }
        generator.writeEndObject();
      }
      generator.writeEndArray();
      generator.writeEndObject();
    }
  }

  private static void deleteQuietly(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException ex) {
      log.warn("Unable to remove temporary file {}", temp, ex);
    }
  }
}
