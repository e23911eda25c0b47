package org.eao.jsa.domain.header;

/**
 * Observing conditions at the start of an observation, already clamped to physical ranges.
 * Components are {@code null} when not recorded.
 *
 * @since 0.1.0
 */
public record EnvironmentFields(
    Double seeing, Double humidity, Double elevation, Double tau, Double ambientTemperature) {

  public static final EnvironmentFields NONE = new EnvironmentFields(null, null, null, null, null);
}
