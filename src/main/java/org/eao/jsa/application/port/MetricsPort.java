package org.eao.jsa.application.port;

/**
 * Port for counters and latency observations emitted by the ingestion pipeline.
 *
 * <p>Implementations must tolerate calls from any thread.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the counter named {@code key} by one.
   *
   * @param key metric name such as {@code ingest.files.read}
   */
  void increment(String key);

  /**
   * Records a measurement such as a latency in milliseconds.
   *
   * @param key metric name
   * @param value measured value
   */
  void observe(String key, long value);

  /** Implementation that discards everything. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
