/**
 * Logging setup and log-hygiene helpers.
 *
 * @since 0.1.0
 */
package org.eao.jsa.logging;
