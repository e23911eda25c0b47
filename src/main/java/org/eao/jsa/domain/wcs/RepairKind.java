package org.eao.jsa.domain.wcs;

/**
 * How a raw four-corner footprint had to be changed before it described a simple polygon.
 *
 * @since 0.1.0
 */
public enum RepairKind {
  /** Corners were already a simple polygon. */
  NONE,
  /** All corners coincided and were expanded to a beam-sized box. */
  POINT,
  /** Corners formed a line along the grid Y axis and were widened by the beam. */
  LINE_Y,
  /** Corners formed a line along the grid X axis and were widened by the beam. */
  LINE_X,
  /** Two corners were recorded in crossed order and were swapped. */
  BOWTIE
}
