package ca.gc.cra.geosync.infrastructure.geo;

import ca.gc.cra.geosync.application.port.PolygonSource;
import ca.gc.cra.geosync.domain.geo.Region;
import ca.gc.cra.geosync.domain.record.FieldValues;
import ca.gc.cra.geosync.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads candidate regions from a GeoJSON {@code FeatureCollection}.
 * <p><strong>Role:</strong> {@link PolygonSource} adapter for the {@code FILE} backend family.</p>
 *
 * <p>Each {@code Polygon} or {@code MultiPolygon} feature becomes one {@link Region} whose id is the value of
 * the configured property. Features of any other geometry type, or without the id property, are skipped.
 * Coordinates are taken as-is in the factory's reference system; no reprojection happens here.</p>
 *
 * @since 0.1.0
 */
public final class GeoJsonPolygonSource implements PolygonSource {
  private static final Logger log = LoggerFactory.getLogger(GeoJsonPolygonSource.class);

  private final Path file;
  private final String idProperty;
  private final GeometryFactory geometryFactory;
  private final JsonSupport json;

  public GeoJsonPolygonSource(Path file, String idProperty, GeometryFactory geometryFactory, JsonSupport json) {
    this.file = Objects.requireNonNull(file, "file");
    this.idProperty = Objects.requireNonNull(idProperty, "idProperty");
    this.geometryFactory = Objects.requireNonNull(geometryFactory, "geometryFactory");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public List<Region> loadAll() throws IOException {
    Object document;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      document = json.parse(reader);
    }
    if (!(document instanceof Map<?, ?> root) || !"FeatureCollection".equals(root.get("type"))) {
      throw new IOException(file + " is not a GeoJSON FeatureCollection");
    }
    List<Region> regions = new ArrayList<>();
    if (root.get("features") instanceof List<?> features) {
      int index = 0;
      for (Object feature : features) {
        readFeature(index++, feature, regions);
      }
    }
    log.debug("Loaded {} regions from {}", regions.size(), file.getFileName());
    return regions;
  }

  private void readFeature(int index, Object feature, List<Region> out) throws IOException {
    if (!(feature instanceof Map<?, ?> map)) {
      throw new IOException(file + ": feature " + index + " is not an object");
    }
    Optional<String> id = map.get("properties") instanceof Map<?, ?> properties
        ? regionId(properties.get(idProperty))
        : Optional.empty();
    if (id.isEmpty()) {
      log.debug("Skipping feature {} in {}: no '{}' property", index, file.getFileName(), idProperty);
      return;
    }
    if (!(map.get("geometry") instanceof Map<?, ?> geometry)) {
      log.debug("Skipping feature {} in {}: no geometry", index, file.getFileName());
      return;
    }
    Object type = geometry.get("type");
    Object coordinates = geometry.get("coordinates");
    try {
      Geometry built;
      if ("Polygon".equals(type)) {
        built = polygon(coordinates);
      } else if ("MultiPolygon".equals(type)) {
        List<?> parts = asList(coordinates);
        Polygon[] polygons = new Polygon[parts.size()];
        for (int i = 0; i < polygons.length; i++) {
          polygons[i] = polygon(parts.get(i));
        }
        built = geometryFactory.createMultiPolygon(polygons);
      } else {
        log.debug("Skipping feature {} in {}: geometry type {}", index, file.getFileName(), type);
        return;
      }
      out.add(new Region(id.get(), built));
    } catch (IllegalArgumentException ex) {
      throw new IOException(file + ": feature " + index + " has invalid geometry: " + ex.getMessage(), ex);
    }
  }

  /**
   * Reads a region id as text so codes such as {@code "0100"} keep their leading zeros. Integral numbers
   * render without a fraction.
   */
  static Optional<String> regionId(Object raw) {
    if (FieldValues.isAbsent(raw)) {
      return Optional.empty();
    }
    String text;
    if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
      double d = ((Number) raw).doubleValue();
      text = Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 9.0e15
          ? Long.toString((long) d)
          : raw.toString();
    } else {
      text = raw.toString().trim();
    }
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  private Polygon polygon(Object rings) {
    List<?> list = asList(rings);
    if (list.isEmpty()) {
      throw new IllegalArgumentException("polygon without rings");
    }
    LinearRing shell = ring(list.get(0));
    LinearRing[] holes = new LinearRing[list.size() - 1];
    for (int i = 1; i < list.size(); i++) {
      holes[i - 1] = ring(list.get(i));
    }
    return geometryFactory.createPolygon(shell, holes);
  }

  private LinearRing ring(Object positions) {
    List<?> list = asList(positions);
    Coordinate[] coordinates = new Coordinate[list.size()];
    for (int i = 0; i < coordinates.length; i++) {
      List<?> position = asList(list.get(i));
      if (position.size() < 2
          || !(position.get(0) instanceof Number x)
          || !(position.get(1) instanceof Number y)) {
        throw new IllegalArgumentException("position " + i + " is not a coordinate pair");
      }
      coordinates[i] = new Coordinate(x.doubleValue(), y.doubleValue());
    }
    return geometryFactory.createLinearRing(coordinates);
  }

  private static List<?> asList(Object value) {
    if (value instanceof List<?> list) {
      return list;
    }
    throw new IllegalArgumentException("expected an array but found " + value);
  }
}
