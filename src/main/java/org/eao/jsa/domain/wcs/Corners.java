package org.eao.jsa.domain.wcs;

import java.util.List;
import java.util.Objects;

/**
 * The four corners of a map footprint in grid order: bottom-left, bottom-right, top-right,
 * top-left. Positions are RA/Dec in degrees.
 *
 * @since 0.1.0
 */
public record Corners(Vec2 bl, Vec2 br, Vec2 tr, Vec2 tl) {

  public Corners {
    Objects.requireNonNull(bl, "bl");
    Objects.requireNonNull(br, "br");
    Objects.requireNonNull(tr, "tr");
    Objects.requireNonNull(tl, "tl");
  }

  /** Vertices in traversal order. */
  public List<Vec2> vertices() {
    return List.of(bl, br, tr, tl);
  }

  Corners swapBottomRightTopRight() {
    return new Corners(bl, tr, br, tl);
  }

  Corners swapTopRightTopLeft() {
    return new Corners(bl, br, tl, tr);
  }
}
