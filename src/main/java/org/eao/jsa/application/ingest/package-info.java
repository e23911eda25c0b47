/**
 * Ingestion pipeline: header extraction, identifier and provenance resolution, metadict
 * aggregation, WCS construction, stale-record reconciliation and store synchronization.
 *
 * <p>{@link org.eao.jsa.application.ingest.IngestUseCase} runs one batch end to end.</p>
 */
package org.eao.jsa.application.ingest;
