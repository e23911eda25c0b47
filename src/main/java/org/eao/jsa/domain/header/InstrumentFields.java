package org.eao.jsa.domain.header;

import java.util.List;

/**
 * Instrument configuration of a file.
 *
 * @param name unambiguous instrument name, e.g. {@code HARP-ACSIS}
 * @param frontend receiver or detector
 * @param backend spectrometer, or the detector for continuum data
 * @param keywords validated instrument keywords
 * @param jcmtObsType {@code OBS_TYPE} as recorded
 * @param samMode {@code SAM_MODE} as recorded
 * @param archiveObsType observation type recorded in the archive
 * @since 0.1.0
 */
public record InstrumentFields(
    String name,
    String frontend,
    String backend,
    List<String> keywords,
    String jcmtObsType,
    String samMode,
    String archiveObsType) {

  public InstrumentFields {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }

  public static final InstrumentFields NONE =
      new InstrumentFields(null, null, null, List.of(), null, null, null);

  public boolean isContinuum() {
    return "SCUBA-2".equals(backend) || "SCUBA-2".equals(frontend);
  }
}
