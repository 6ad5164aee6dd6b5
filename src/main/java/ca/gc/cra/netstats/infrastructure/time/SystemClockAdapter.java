package ca.gc.cra.netstats.infrastructure.time;

import ca.gc.cra.netstats.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()} without smoothing.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
