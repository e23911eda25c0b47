/**
 * World-coordinate summaries: footprint repair, hybrid spectral groups, and the spatial, spectral
 * and temporal axes attached to chunks.
 *
 * @since 0.1.0
 */
package org.eao.jsa.domain.wcs;
