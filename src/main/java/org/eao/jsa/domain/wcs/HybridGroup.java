package org.eao.jsa.domain.wcs;

/**
 * Union of the frequency coverage of every subsystem sharing one {@link HybridKey}.
 *
 * @param key shared tuning
 * @param signalLowerGHz minimum signal lower bound
 * @param signalUpperGHz maximum signal upper bound
 * @param imageLowerGHz minimum image lower bound, {@code NaN} when no member has an image band
 * @param imageUpperGHz maximum image upper bound, {@code NaN} when no member has an image band
 * @since 0.1.0
 */
public record HybridGroup(
    HybridKey key,
    double signalLowerGHz,
    double signalUpperGHz,
    double imageLowerGHz,
    double imageUpperGHz) {

  /** Starts a group from its first subsystem. */
  public static HybridGroup of(SubsystemRecord subsystem) {
    return new HybridGroup(
        subsystem.hybridKey(),
        subsystem.signalLowerGHz(),
        subsystem.signalUpperGHz(),
        subsystem.imageLowerGHz(),
        subsystem.imageUpperGHz());
  }

  /**
   * Widens the group with another subsystem of the same key.
   *
   * @param subsystem subsystem to include
   * @return widened group
   * @throws IllegalArgumentException when the subsystem belongs to another group
   */
  public HybridGroup including(SubsystemRecord subsystem) {
    if (!key.equals(subsystem.hybridKey())) {
      throw new IllegalArgumentException(
          "subsystem " + subsystem.hybridKey() + " does not belong to hybrid group " + key);
    }
    return new HybridGroup(
        key,
        min(signalLowerGHz, subsystem.signalLowerGHz()),
        max(signalUpperGHz, subsystem.signalUpperGHz()),
        min(imageLowerGHz, subsystem.imageLowerGHz()),
        max(imageUpperGHz, subsystem.imageUpperGHz()));
  }

  /** Mean signal frequency in GHz. */
  public double meanFrequencyGHz() {
    return (signalLowerGHz + signalUpperGHz) / 2.0;
  }

  /** Spectral resolving power {@code |f / df|} at the mean frequency. */
  public double resolvingPower() {
    return Math.abs(1.0e9 * meanFrequencyGHz() / key.ifChannelSpacingHz());
  }

  /** Beam size in degrees at the mean frequency. */
  public double beamSizeDeg() {
    return BeamSize.heterodyne(meanFrequencyGHz());
  }

  private static double min(double a, double b) {
    if (Double.isNaN(a)) {
      return b;
    }
    if (Double.isNaN(b)) {
      return a;
    }
    return Math.min(a, b);
  }

  private static double max(double a, double b) {
    if (Double.isNaN(a)) {
      return b;
    }
    if (Double.isNaN(b)) {
      return a;
    }
    return Math.max(a, b);
  }
}
