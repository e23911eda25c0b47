/**
 * Adapters implementing the application ports: header sources, record stores, JSON codecs and
 * metrics.
 *
 * @since 0.1.0
 */
package org.eao.jsa.infrastructure;
