package com.example.datalake.dsdust.fetch;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Process-wide pacing for catalog calls. Each call takes a permit, waits a jittered delay drawn
 * uniformly from {@code [minDelay, 1.5 * minDelay]} and only then runs, so concurrent searches
 * share one request rate instead of bursting together.
 */
public class RequestGate {

  private final Semaphore permits;
  private final Duration minDelay;
  private final Sleeper sleeper;
  private final DoubleSupplier random;

  public RequestGate(int permits, Duration minDelay, Sleeper sleeper) {
    this(permits, minDelay, sleeper, () -> ThreadLocalRandom.current().nextDouble());
  }

  public RequestGate(int permits, Duration minDelay, Sleeper sleeper, DoubleSupplier random) {
    if (permits <= 0) {
      throw new IllegalArgumentException("permits must be positive");
    }
    this.permits = new Semaphore(permits, true);
    this.minDelay = minDelay == null ? Duration.ZERO : minDelay;
    this.sleeper = sleeper;
    this.random = random;
  }

  /** Runs {@code call} once its turn comes up. */
  public <T> T pace(CatalogCall<T> call) {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchCancelledException("Interrupted while waiting for a request slot", e);
    }
    try {
      sleeper.sleep(jitteredDelay());
      return call.execute();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchCancelledException("Interrupted during request pacing", e);
    } finally {
      permits.release();
    }
  }

  Duration jitteredDelay() {
    long base = minDelay.toMillis();
    return Duration.ofMillis(base + Math.round(base * 0.5 * random.getAsDouble()));
  }

  @FunctionalInterface
  public interface CatalogCall<T> {
    T execute();
  }
}
