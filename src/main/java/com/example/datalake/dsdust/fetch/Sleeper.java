package com.example.datalake.dsdust.fetch;

import java.time.Duration;

/** Blocking pause used for request pacing and backoff. Swapped for a recording fake in tests. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper system() {
    return d -> {
      if (!d.isNegative() && !d.isZero()) {
        Thread.sleep(d.toMillis());
      }
    };
  }
}
