package ca.gc.cra.geosync.infrastructure.extract;

import ca.gc.cra.geosync.application.port.RecordExtractor;
import ca.gc.cra.geosync.domain.record.Record;
import ca.gc.cra.geosync.domain.record.Table;
import ca.gc.cra.geosync.infrastructure.json.JsonSupport;
import ca.gc.cra.geosync.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads newline-delimited JSON files: one flat object per line, blank lines ignored.
 *
 * <p>Nested objects and arrays are rejected because records only carry scalar values.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonRecordExtractor implements RecordExtractor {
  private static final Logger log = LoggerFactory.getLogger(NdjsonRecordExtractor.class);
  private static final Set<String> EXTENSIONS = Set.of("ndjson", "jsonl");
  private static final int MAX_ECHO_BYTES = 120;

  private final JsonSupport json;

  public NdjsonRecordExtractor(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public boolean supports(Path file) {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    return dot > 0 && EXTENSIONS.contains(name.substring(dot + 1));
  }

  @Override
  public Table extract(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    Set<String> columns = new LinkedHashSet<>();
    List<Record> rows = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        Map<String, Object> fields = parseLine(file, lineNumber, line);
        columns.addAll(fields.keySet());
        rows.add(Record.of(fields));
      }
    }
    log.debug("Extracted {} rows with {} columns from {}", rows.size(), columns.size(), file.getFileName());
    return Table.of(columns, rows);
  }

  private Map<String, Object> parseLine(Path file, int lineNumber, String line) throws IOException {
    Object parsed;
    try {
      parsed = json.parse(line);
    } catch (IllegalArgumentException ex) {
      throw new IOException(file.getFileName() + ":" + lineNumber + " is not valid JSON: "
          + Logs.truncate(line, MAX_ECHO_BYTES), ex);
    }
    if (!(parsed instanceof Map<?, ?> object)) {
      throw new IOException(file.getFileName() + ":" + lineNumber + " must be a JSON object");
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : object.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof List<?>) {
        throw new IOException(file.getFileName() + ":" + lineNumber + " field '" + entry.getKey()
            + "' must be a scalar");
      }
      fields.put(String.valueOf(entry.getKey()), value);
    }
    return fields;
  }
}
