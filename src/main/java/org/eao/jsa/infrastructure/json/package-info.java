/**
 * JSON serialization built on Jackson's streaming API: a generic document reader and the codec
 * for stored observations.
 *
 * @since 0.1.0
 */
package org.eao.jsa.infrastructure.json;
