/**
 * Command-line entry points: the {@code jsa-ingest} dispatcher and the {@code ingest} and
 * {@code check} commands.
 *
 * @since 0.1.0
 */
package org.eao.jsa.api;
