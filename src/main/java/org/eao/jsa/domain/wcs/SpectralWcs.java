package org.eao.jsa.domain.wcs;

import java.util.List;

/**
 * Spectral coverage of a chunk.
 *
 * <p>Heterodyne data use {@code FREQ} in GHz, one sample per sideband; continuum data use
 * {@code WAVE} in metres with a single sample.</p>
 *
 * @param ctype axis type, {@code FREQ} or {@code WAVE}
 * @param unit axis unit
 * @param specsys spectral reference frame
 * @param restFrequencyHz rest frequency, {@code null} for continuum data
 * @param samples covered ranges sorted by start
 * @param resolvingPower spectral resolving power
 * @param bandpassName filter name for continuum data, otherwise {@code null}
 * @param species molecular species, may be {@code null}
 * @param transition molecular transition, may be {@code null}
 * @since 0.1.0
 */
public record SpectralWcs(
    String ctype,
    String unit,
    String specsys,
    Double restFrequencyHz,
    List<CoordRange> samples,
    double resolvingPower,
    String bandpassName,
    String species,
    String transition) {

  public SpectralWcs {
    samples = List.copyOf(samples);
  }
}
