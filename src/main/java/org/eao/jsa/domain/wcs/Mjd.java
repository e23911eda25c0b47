package org.eao.jsa.domain.wcs;

import java.time.Instant;

/**
 * Modified Julian Date conversions.
 *
 * @since 0.1.0
 */
public final class Mjd {
  private static final double UNIX_EPOCH_MJD = 40587.0;
  private static final double SECONDS_PER_DAY = 86400.0;

  private Mjd() {}

  public static double of(Instant instant) {
    return UNIX_EPOCH_MJD + (instant.getEpochSecond() + instant.getNano() / 1.0e9) / SECONDS_PER_DAY;
  }

  public static Instant toInstant(double mjd) {
    double seconds = (mjd - UNIX_EPOCH_MJD) * SECONDS_PER_DAY;
    long whole = (long) Math.floor(seconds);
    long nanos = Math.round((seconds - whole) * 1.0e9);
    return Instant.ofEpochSecond(whole, nanos);
  }

  /** Length of an MJD interval in seconds. */
  public static double seconds(double startMjd, double endMjd) {
    return (endMjd - startMjd) * SECONDS_PER_DAY;
  }
}
