package org.eao.jsa.domain.header;

/**
 * Target of a file.
 *
 * @param name normalized target name
 * @param redshift source redshift for heterodyne data, or {@code null}
 * @param type {@code field} or {@code object}, or {@code null}
 * @param standard whether the target is a calibration standard, or {@code null}
 * @param moving whether the target moves
 * @param ra ICRS right ascension in degrees, {@code null} for moving targets
 * @param dec ICRS declination in degrees, {@code null} for moving targets
 * @param telescope telescope name
 * @since 0.1.0
 */
public record TargetFields(
    String name,
    Double redshift,
    String type,
    Boolean standard,
    boolean moving,
    Double ra,
    Double dec,
    String telescope) {}
