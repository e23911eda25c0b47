package org.eao.jsa.domain.wcs;

/**
 * Planar point or displacement; for sky positions {@code x} is right ascension and {@code y}
 * declination, both in degrees.
 *
 * @param x first coordinate
 * @param y second coordinate
 * @since 0.1.0
 */
public record Vec2(double x, double y) {

  public Vec2 plus(Vec2 other) {
    return new Vec2(x + other.x, y + other.y);
  }

  public Vec2 minus(Vec2 other) {
    return new Vec2(x - other.x, y - other.y);
  }

  public Vec2 times(double factor) {
    return new Vec2(x * factor, y * factor);
  }

  public double length() {
    return Math.hypot(x, y);
  }

  /** Z component of the 3-D cross product of two planar vectors. */
  public double cross(Vec2 other) {
    return x * other.y - y * other.x;
  }

  /**
   * Tangent-plane displacement from {@code origin} to this sky position, in degrees with the RA
   * component scaled by {@code cos(dec)} and wrapped into {@code [-180, 180)}.
   *
   * @param origin reference position
   * @return local offset in degrees
   */
  public Vec2 offsetFrom(Vec2 origin) {
    double dra = x - origin.x;
    while (dra >= 180.0) {
      dra -= 360.0;
    }
    while (dra < -180.0) {
      dra += 360.0;
    }
    double cosdec = Math.cos(Math.toRadians(origin.y));
    return new Vec2(dra * cosdec, y - origin.y);
  }

  /**
   * Applies a tangent-plane offset (RA component in true degrees on the sky) to this position.
   *
   * @param offset local offset, RA component uncorrected for declination
   * @return displaced sky position
   */
  public Vec2 displacedBy(Vec2 offset) {
    double cosdec = Math.cos(Math.toRadians(y));
    return new Vec2(x + offset.x / cosdec, y + offset.y);
  }
}
