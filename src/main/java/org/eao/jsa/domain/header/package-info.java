/**
 * File headers as delivered by header sources and the typed field groups extracted from them.
 *
 * @since 0.1.0
 */
package org.eao.jsa.domain.header;
