/**
 * The per-run aggregation model: observation and plane records with their merge policies.
 *
 * @since 0.1.0
 */
package org.eao.jsa.domain.metadict;
