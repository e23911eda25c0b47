/**
 * Ports between the ingestion use case and its collaborators: header sources, the record store
 * and its query interface, metrics and clocks.
 * <p>Adapters in {@code org.eao.jsa.infrastructure} implement these interfaces.</p>
 *
 * @since 0.1.0
 */
package org.eao.jsa.application.port;
