package org.eao.jsa.domain.wcs;

import org.eao.jsa.domain.error.GeometryException;

/**
 * Turns the four recorded corners of a map into a simple polygon.
 *
 * <p>Cases are tried in order:
 * <ol>
 *   <li>all corners coincide within {@link #EPSILON_DEG}: a box one beam wide centred on them,</li>
 *   <li>the bottom and top pairs coincide (a line along grid Y) or the left and right pairs
 *       coincide (a line along grid X): the line widened by one beam,</li>
 *   <li>otherwise the winding is checked with the signed included angle at every corner and the
 *       crossed pair of corners is swapped when the signs disagree.</li>
 * </ol>
 * Offsets are measured on the tangent plane, so RA offsets are divided by {@code cos(dec)}.
 *
 * <p>Pure and stateless.</p>
 *
 * @since 0.1.0
 */
public final class FootprintRepair {
  /** Coincidence tolerance, 0.1 arcsec. */
  public static final double EPSILON_DEG = 0.1 / 3600.0;

  private static final double SIN_EPSILON = Math.sin(Math.toRadians(EPSILON_DEG)) * 1e-3;

  private FootprintRepair() {}

  /**
   * Repairs the footprint.
   *
   * @param corners recorded corners
   * @param beamSizeDeg instrument beam size in degrees; only used for degenerate footprints and may
   *     be {@code NaN} when unknown
   * @return repaired footprint
   * @throws GeometryException when the footprint is degenerate and cannot be repaired
   */
  public static Footprint repair(Corners corners, double beamSizeDeg) throws GeometryException {
    Vec2 bl = corners.bl();
    Vec2 br = corners.br();
    Vec2 tr = corners.tr();
    Vec2 tl = corners.tl();

    boolean bottomCollapsed = coincide(bl, br);
    boolean topCollapsed = coincide(tl, tr);
    boolean leftCollapsed = coincide(bl, tl);
    boolean rightCollapsed = coincide(br, tr);

    if (bottomCollapsed && topCollapsed && leftCollapsed) {
      double halfBeam = requireBeam(beamSizeDeg, "point-like") / 2.0;
      Vec2 centre = bl;
      return new Footprint(
          new Corners(
              centre.displacedBy(new Vec2(-halfBeam, -halfBeam)),
              centre.displacedBy(new Vec2(halfBeam, -halfBeam)),
              centre.displacedBy(new Vec2(halfBeam, halfBeam)),
              centre.displacedBy(new Vec2(-halfBeam, halfBeam))),
          RepairKind.POINT);
    }
    if (bottomCollapsed && topCollapsed) {
      double halfBeam = requireBeam(beamSizeDeg, "line-like") / 2.0;
      Vec2 side = perpendicular(bl, tl, halfBeam);
      Vec2 negSide = side.times(-1.0);
      return new Footprint(
          new Corners(
              bl.displacedBy(negSide),
              bl.displacedBy(side),
              tl.displacedBy(side),
              tl.displacedBy(negSide)),
          RepairKind.LINE_Y);
    }
    if (leftCollapsed && rightCollapsed) {
      double halfBeam = requireBeam(beamSizeDeg, "line-like") / 2.0;
      Vec2 side = perpendicular(bl, br, halfBeam);
      Vec2 negSide = side.times(-1.0);
      return new Footprint(
          new Corners(
              bl.displacedBy(side),
              br.displacedBy(side),
              br.displacedBy(negSide),
              bl.displacedBy(negSide)),
          RepairKind.LINE_X);
    }

    if (consistentWinding(corners)) {
      return new Footprint(corners, RepairKind.NONE);
    }
    Corners swapped = corners.swapBottomRightTopRight();
    if (consistentWinding(swapped)) {
      return new Footprint(swapped, RepairKind.BOWTIE);
    }
    swapped = corners.swapTopRightTopLeft();
    if (consistentWinding(swapped)) {
      return new Footprint(swapped, RepairKind.BOWTIE);
    }
    throw new GeometryException("footprint corners cannot be ordered into a simple polygon: " + corners);
  }

  /**
   * Signed angle at {@code b} between the great circles towards {@code a} and {@code c}.
   *
   * <p>The magnitude is the included angle in radians; the sign gives the turning direction, so
   * the four angles of a simple quadrilateral share one sign.</p>
   *
   * @param a previous vertex
   * @param b vertex where the angle is measured
   * @param c next vertex
   * @return signed included angle in radians
   * @throws GeometryException when two of the points coincide or the three are collinear
   */
  public static double signedIncludedAngle(Vec2 a, Vec2 b, Vec2 c) throws GeometryException {
    Vec3 va = Vec3.onSphere(a);
    Vec3 vb = Vec3.onSphere(b);
    Vec3 vc = Vec3.onSphere(c);
    Vec3 n1 = va.minus(vb).cross(vb);
    Vec3 n2 = vc.minus(vb).cross(vb);
    double l1 = n1.length();
    double l2 = n2.length();
    if (l1 < SIN_EPSILON || l2 < SIN_EPSILON) {
      throw new GeometryException("coincident corners at " + b);
    }
    n1 = n1.scaled(1.0 / l1);
    n2 = n2.scaled(1.0 / l2);
    double cos = Math.max(-1.0, Math.min(1.0, n1.dot(n2)));
    double orientation = n1.cross(n2).dot(vb);
    if (Math.abs(orientation) < 1e-12) {
      throw new GeometryException("collinear corners at " + b);
    }
    return Math.copySign(Math.acos(cos), orientation);
  }

  private static boolean consistentWinding(Corners corners) throws GeometryException {
    Vec2 bl = corners.bl();
    Vec2 br = corners.br();
    Vec2 tr = corners.tr();
    Vec2 tl = corners.tl();
    double s1 = Math.signum(signedIncludedAngle(tl, bl, br));
    double s2 = Math.signum(signedIncludedAngle(bl, br, tr));
    double s3 = Math.signum(signedIncludedAngle(br, tr, tl));
    double s4 = Math.signum(signedIncludedAngle(tr, tl, bl));
    return s1 == s2 && s2 == s3 && s3 == s4;
  }

  private static boolean coincide(Vec2 a, Vec2 b) {
    Vec2 offset = b.offsetFrom(a);
    return Math.abs(offset.x()) < EPSILON_DEG && Math.abs(offset.y()) < EPSILON_DEG;
  }

  /** Unit perpendicular to the line {@code from -> to} on the tangent plane, scaled to {@code size}. */
  private static Vec2 perpendicular(Vec2 from, Vec2 to, double size) {
    Vec2 along = to.offsetFrom(from);
    double length = along.length();
    return new Vec2(along.y() / length * size, -along.x() / length * size);
  }

  private static double requireBeam(double beamSizeDeg, String shape) throws GeometryException {
    if (Double.isNaN(beamSizeDeg) || Double.isInfinite(beamSizeDeg) || beamSizeDeg <= 0.0) {
      throw new GeometryException(
          "footprint is " + shape + " but no beam size is available to widen it");
    }
    return beamSizeDeg;
  }
}
