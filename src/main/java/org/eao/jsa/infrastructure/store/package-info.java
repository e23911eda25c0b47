/**
 * Record store adapters: an in-memory store that also answers archive queries, and a JSON
 * directory store built on it.
 *
 * @since 0.1.0
 */
package org.eao.jsa.infrastructure.store;
