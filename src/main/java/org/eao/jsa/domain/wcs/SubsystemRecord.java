package org.eao.jsa.domain.wcs;

import java.util.Objects;

/**
 * Spectral tuning of one heterodyne subsystem as recorded in one file.
 *
 * <p>Frequency bounds are in GHz; image bounds are {@code NaN} when the receiver has no image band.</p>
 *
 * @since 0.1.0
 */
public record SubsystemRecord(
    double restFrequencyHz,
    double ifFrequencyGHz,
    double ifChannelSpacingHz,
    double signalLowerGHz,
    double signalUpperGHz,
    double imageLowerGHz,
    double imageUpperGHz,
    SidebandMode sidebandMode) {

  public SubsystemRecord {
    Objects.requireNonNull(sidebandMode, "sidebandMode");
  }

  /** Key shared by subsystems that merge into one hybrid group. */
  public HybridKey hybridKey() {
    return new HybridKey(restFrequencyHz, ifFrequencyGHz, ifChannelSpacingHz);
  }

  /** Whether this subsystem reports an image band. */
  public boolean hasImageBand() {
    return !Double.isNaN(imageLowerGHz) && !Double.isNaN(imageUpperGHz);
  }
}
