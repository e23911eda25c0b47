package org.eao.jsa.validation;

/**
 * Numeric range helpers.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that {@code value} lies within {@code [min, max]}.
   *
   * @param name label used in exception messages
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Clamps a physical measurement into {@code [min, max]}.
   *
   * @param value measured value; NaN is returned unchanged
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return clamped value
   */
  public static double clamp(double value, double min, double max) {
    if (Double.isNaN(value)) {
      return value;
    }
    return Math.max(min, Math.min(max, value));
  }

  /**
   * Tells whether two doubles agree within an absolute tolerance.
   *
   * @param a first value
   * @param b second value
   * @param epsilon absolute tolerance
   * @return {@code true} when {@code |a - b| < epsilon}
   */
  public static boolean near(double a, double b, double epsilon) {
    return Math.abs(a - b) < epsilon;
  }
}
