package com.sidexkit.engine.crypto;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall-clock milliseconds, bumped when needed so that every value handed out is strictly
 * greater than the previous one. Used for request timestamps and action nonces, which
 * venues reject when reused.
 */
public final class NonceSource {

  private final Clock clock;
  private final AtomicLong last = new AtomicLong();

  public NonceSource(Clock clock) {
    this.clock = clock;
  }

  public long next() {
    long now = clock.millis();
    return last.updateAndGet(prev -> Math.max(now, prev + 1));
  }
}
