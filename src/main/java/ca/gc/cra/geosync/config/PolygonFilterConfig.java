package ca.gc.cra.geosync.config;

import ca.gc.cra.geosync.validation.Strings;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Location of the reference region used to filter spatial sources.
 *
 * @param file GeoJSON FeatureCollection holding candidate polygons
 * @param idProperty feature property carrying the region identifier
 * @param polygonId identifier of the region to filter by
 * @since 0.1.0
 */
public record PolygonFilterConfig(Path file, String idProperty, String polygonId) {
  public PolygonFilterConfig {
    file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
    idProperty = Strings.requireNonBlank("polygonIdProperty", idProperty);
    polygonId = Strings.requireNonBlank("polygonId", polygonId);
  }
}
