package org.eao.jsa.application.port;

/**
 * Time source used to measure synchronization latency.
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /** Current time in epoch milliseconds. */
  long nowMillis();

  /** Clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
