package ca.gc.cra.geosync.infrastructure.geo;

import ca.gc.cra.geosync.application.port.PolygonSource;
import ca.gc.cra.geosync.domain.geo.Region;
import java.util.List;

/** Fixed list of regions, used by the in-memory backend. */
public final class InMemoryPolygonSource implements PolygonSource {
  private final List<Region> regions;

  public InMemoryPolygonSource(List<Region> regions) {
    this.regions = List.copyOf(regions);
  }

  @Override
  public List<Region> loadAll() {
    return regions;
  }
}
