package org.eao.jsa.domain.wcs;

/**
 * Outcome of footprint repair.
 *
 * @param corners polygon corners safe to use as a spatial bound
 * @param repair what was changed to obtain {@code corners}
 * @since 0.1.0
 */
public record Footprint(Corners corners, RepairKind repair) {}
