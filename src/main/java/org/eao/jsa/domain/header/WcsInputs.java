package org.eao.jsa.domain.header;

import java.time.Instant;
import org.eao.jsa.domain.wcs.Corners;
import org.eao.jsa.domain.wcs.SubsystemRecord;

/**
 * Header values the WCS builder needs for one file. Any component may be {@code null}.
 *
 * @param corners map corners
 * @param subsystem heterodyne spectral tuning
 * @param wavelengthMicrons continuum filter wavelength
 * @param bandwidthMicrons continuum filter bandwidth
 * @param start observation start
 * @param end observation end
 * @since 0.1.0
 */
public record WcsInputs(
    Corners corners,
    SubsystemRecord subsystem,
    Double wavelengthMicrons,
    Double bandwidthMicrons,
    Instant start,
    Instant end) {

  public static final WcsInputs NONE = new WcsInputs(null, null, null, null, null, null);
}
