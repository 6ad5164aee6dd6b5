package ca.gc.cra.netstats.testutil;

import ca.gc.cra.netstats.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/** Manually advanced clock for cache and timestamp tests. */
public final class FakeClock implements ClockPort {
  private final AtomicLong millis;

  public FakeClock(Instant start) {
    this.millis = new AtomicLong(start.toEpochMilli());
  }

  @Override
  public long nowMillis() {
    return millis.get();
  }

  public void advance(Duration step) {
    millis.addAndGet(step.toMillis());
  }

  public void set(Instant instant) {
    millis.set(instant.toEpochMilli());
  }
}
