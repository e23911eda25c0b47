/**
 * Run configuration: defaults per mode, YAML loading, precedence merging, run-id aliases and the
 * composition root.
 *
 * @since 0.1.0
 */
package org.eao.jsa.config;
