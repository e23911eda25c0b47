package org.eao.jsa.config;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.eao.jsa.application.ingest.IngestUseCase;
import org.eao.jsa.application.ingest.RunAliases;
import org.eao.jsa.application.port.ClockPort;
import org.eao.jsa.application.port.HeaderSource;
import org.eao.jsa.application.port.MetricsPort;
import org.eao.jsa.application.port.ProcessOptions;
import org.eao.jsa.domain.error.StoreException;
import org.eao.jsa.infrastructure.header.JsonHeaderSource;
import org.eao.jsa.infrastructure.json.ObservationJsonCodec;
import org.eao.jsa.infrastructure.json.ObservationJsonWriter;
import org.eao.jsa.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.eao.jsa.infrastructure.metrics.TelemetrySettings;
import org.eao.jsa.infrastructure.store.JsonDirectoryRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires an {@link IngestConfig} to the adapters and the ingestion use case.
 * <p><strong>Why:</strong> Keeps adapter construction in one place so the CLI only deals with
 * arguments and exit codes.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the record store once; it also answers archive queries.</li>
 *   <li>Load run-id aliases from the recipe-instance mapping when configured.</li>
 *   <li>Own the metrics adapter and flush it on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; create one per CLI invocation.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final IngestConfig config;
  private final OpenTelemetryMetricsAdapter metrics;
  private final ClockPort clock;
  private JsonDirectoryRecordStore store;

  /**
   * @param config validated run configuration
   * @param telemetry metrics exporter settings
   */
  public CompositionRoot(IngestConfig config, TelemetrySettings telemetry) {
    this(config, new OpenTelemetryMetricsAdapter(telemetry), ClockPort.SYSTEM);
  }

  CompositionRoot(IngestConfig config, OpenTelemetryMetricsAdapter metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public IngestConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public HeaderSource headerSource() {
    return new JsonHeaderSource(config.headers());
  }

  /**
   * Opens the record store on first use.
   *
   * @return shared store instance
   * @throws StoreException when the store directory cannot be loaded
   */
  public JsonDirectoryRecordStore recordStore() throws StoreException {
    if (store == null) {
      store = JsonDirectoryRecordStore.open(config.store());
    }
    return store;
  }

  /**
   * Loads run-id aliases.
   *
   * @return aliases from the configured mapping file, or none
   * @throws IOException when the mapping file cannot be read
   */
  public RunAliases runAliases() throws IOException {
    if (config.recipeInstanceMapping().isEmpty()) {
      return RunAliases.NONE;
    }
    RecipeInstanceMapping mapping = RecipeInstanceMapping.load(config.recipeInstanceMapping().get());
    log.info("Loaded {} run ids from recipe instance mapping {}", mapping.size(),
        config.recipeInstanceMapping().get());
    return mapping;
  }

  /** Writer for the batch output directory, when one is configured. */
  public Optional<ObservationJsonWriter> batchWriter() {
    return config.out().map(dir -> new ObservationJsonWriter(dir, new ObservationJsonCodec()));
  }

  /**
   * Builds the ingestion use case.
   *
   * @return use case bound to the configured store and collection
   * @throws IOException when the alias mapping cannot be read
   * @throws StoreException when the record store cannot be opened
   */
  public IngestUseCase ingestUseCase() throws IOException, StoreException {
    JsonDirectoryRecordStore records = recordStore();
    return new IngestUseCase(
        config.collection(),
        records,
        records,
        runAliases(),
        metrics,
        clock,
        new ProcessOptions(config.dryRun(), config.allowRemove()),
        config.failFast(),
        config.mode() == IngestMode.CHECK);
  }

  @Override
  public void close() {
    metrics.close();
  }
}
