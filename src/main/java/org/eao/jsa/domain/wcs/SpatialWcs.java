package org.eao.jsa.domain.wcs;

import java.util.List;

/**
 * Polygon footprint in ICRS, equinox 2000.
 *
 * @param vertices polygon vertices, RA/Dec in degrees
 * @param repair how the recorded corners were adjusted
 * @since 0.1.0
 */
public record SpatialWcs(List<Vec2> vertices, RepairKind repair) {
  public static final String COORDSYS = "ICRS";
  public static final double EQUINOX = 2000.0;

  public SpatialWcs {
    vertices = List.copyOf(vertices);
  }

  public static SpatialWcs of(Footprint footprint) {
    return new SpatialWcs(footprint.corners().vertices(), footprint.repair());
  }
}
