package org.eao.jsa.domain.header;

/**
 * Product description of a file.
 *
 * @param product {@code PRODUCT}
 * @param filter continuum filter in microns ({@code FILTER})
 * @param restFrequencyHz rest frequency ({@code RESTFREQ}, {@code RESTWAV} or {@code RESTFRQ})
 * @param subsystemNumber {@code SUBSYSNR}
 * @param bandwidthMode {@code BWMODE}
 * @param explicitProductId {@code PRODID} of externally produced data
 * @param calibrationLevel {@code CALLEVEL} of externally produced data
 * @param dataProductType image, spectrum, cube or catalog
 * @param productTypes {@code PRODTYPE} declaration, or {@code null}
 * @param species molecular species ({@code MOLECULE}), or {@code null}
 * @param transition molecular transition ({@code TRANSITI}), or {@code null}
 * @since 0.1.0
 */
public record ProductFields(
    String product,
    String filter,
    Double restFrequencyHz,
    String subsystemNumber,
    String bandwidthMode,
    String explicitProductId,
    String calibrationLevel,
    String dataProductType,
    String productTypes,
    String species,
    String transition) {}
