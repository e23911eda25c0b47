package org.eao.jsa.domain.wcs;

/**
 * Identity of a hybrid spectral group: subsystems tuned identically belong together.
 *
 * @param restFrequencyHz rest frequency in Hz
 * @param ifFrequencyGHz intermediate frequency in GHz
 * @param ifChannelSpacingHz channel spacing in Hz
 * @since 0.1.0
 */
public record HybridKey(double restFrequencyHz, double ifFrequencyGHz, double ifChannelSpacingHz) {}
