/**
 * OpenTelemetry implementation of the metrics port.
 *
 * @since 0.1.0
 */
package org.eao.jsa.infrastructure.metrics;
