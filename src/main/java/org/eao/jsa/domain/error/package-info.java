/**
 * Checked failures raised by the ingestion stages.
 *
 * @since 0.1.0
 */
package org.eao.jsa.domain.error;
