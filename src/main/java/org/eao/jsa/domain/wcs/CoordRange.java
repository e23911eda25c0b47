package org.eao.jsa.domain.wcs;

/**
 * One-dimensional world-coordinate range covering pixels 0.5 to 1.5.
 *
 * @param start world value at pixel 0.5
 * @param end world value at pixel 1.5
 * @since 0.1.0
 */
public record CoordRange(double start, double end) {

  public CoordRange {
    if (Double.isNaN(start) || Double.isNaN(end)) {
      throw new IllegalArgumentException("range bounds must be numbers");
    }
  }

  /** Range with bounds sorted ascending. */
  public static CoordRange between(double a, double b) {
    return new CoordRange(Math.min(a, b), Math.max(a, b));
  }
}
