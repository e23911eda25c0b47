package org.eao.jsa.domain.wcs;

/**
 * Cartesian vector used to treat sky positions as points on the unit sphere.
 *
 * @param x component towards RA 0, Dec 0
 * @param y component towards RA 90, Dec 0
 * @param z component towards the north pole
 * @since 0.1.0
 */
public record Vec3(double x, double y, double z) {

  /**
   * Unit vector for a sky position.
   *
   * @param position RA/Dec in degrees
   * @return unit vector
   */
  public static Vec3 onSphere(Vec2 position) {
    double ra = Math.toRadians(position.x());
    double dec = Math.toRadians(position.y());
    double cosdec = Math.cos(dec);
    return new Vec3(Math.cos(ra) * cosdec, Math.sin(ra) * cosdec, Math.sin(dec));
  }

  public Vec3 minus(Vec3 other) {
    return new Vec3(x - other.x, y - other.y, z - other.z);
  }

  public Vec3 cross(Vec3 other) {
    return new Vec3(
        y * other.z - z * other.y,
        z * other.x - x * other.z,
        x * other.y - y * other.x);
  }

  public double dot(Vec3 other) {
    return x * other.x + y * other.y + z * other.z;
  }

  public double length() {
    return Math.sqrt(dot(this));
  }

  public Vec3 scaled(double factor) {
    return new Vec3(x * factor, y * factor, z * factor);
  }
}
