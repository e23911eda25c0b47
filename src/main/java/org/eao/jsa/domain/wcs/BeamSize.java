package org.eao.jsa.domain.wcs;

/**
 * Approximate instrument beam sizes, in degrees.
 *
 * @since 0.1.0
 */
public final class BeamSize {
  private static final double HETERODYNE_FACTOR = 1.435;
  private static final double CONTINUUM_FACTOR = 4.787e-6;

  private BeamSize() {}

  /**
   * Heterodyne beam for the mean observed frequency.
   *
   * @param meanFrequencyGHz mean sky frequency in GHz
   * @return beam size in degrees, or {@code NaN} when the frequency is not positive
   */
  public static double heterodyne(double meanFrequencyGHz) {
    if (!(meanFrequencyGHz > 0.0)) {
      return Double.NaN;
    }
    return HETERODYNE_FACTOR / meanFrequencyGHz;
  }

  /**
   * Continuum beam for a filter wavelength.
   *
   * @param wavelengthMicrons filter wavelength in microns
   * @return beam size in degrees, or {@code NaN} when the wavelength is not positive
   */
  public static double continuum(double wavelengthMicrons) {
    if (!(wavelengthMicrons > 0.0)) {
      return Double.NaN;
    }
    return CONTINUUM_FACTOR * wavelengthMicrons;
  }
}
