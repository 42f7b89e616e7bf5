package com.example.datalake.dsdust.fetch;

import com.example.datalake.dsdust.catalog.CatalogException;
import com.example.datalake.dsdust.catalog.DatasetCatalogClient;
import com.example.datalake.dsdust.catalog.RateLimitedException;
import com.example.datalake.dsdust.catalog.RetriesExhaustedException;
import com.example.datalake.dsdust.model.CatalogPage;
import com.example.datalake.dsdust.model.FileInfo;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Paced, retrying access to the catalog.
 *
 * <p>Rate-limit responses back off exponentially ({@code base * 2^attempt + jitter(0,1s)}, capped at
 * {@code maxDelay}); other transient failures back off linearly ({@code base * (attempt + 1)}).
 * After {@code maxRetries} retries the call fails with {@link RetriesExhaustedException}.
 * Non-retryable failures propagate on the first attempt.
 */
@Slf4j
public class RateLimitedFetcher {

  private final DatasetCatalogClient client;
  private final RequestGate gate;
  private final Sleeper sleeper;
  private final DoubleSupplier random;
  private final Duration backoffBase;
  private final Duration maxDelay;
  private final int maxRetries;

  public RateLimitedFetcher(DatasetCatalogClient client, RequestGate gate, Sleeper sleeper,
                            Duration backoffBase, Duration maxDelay, int maxRetries) {
    this(client, gate, sleeper, () -> ThreadLocalRandom.current().nextDouble(), backoffBase, maxDelay, maxRetries);
  }

  public RateLimitedFetcher(DatasetCatalogClient client, RequestGate gate, Sleeper sleeper, DoubleSupplier random,
                            Duration backoffBase, Duration maxDelay, int maxRetries) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
    this.client = client;
    this.gate = gate;
    this.sleeper = sleeper;
    this.random = random;
    this.backoffBase = backoffBase;
    this.maxDelay = maxDelay;
    this.maxRetries = maxRetries;
  }

  public CatalogPage fetch(String query, int page, String fileType) {
    return withRetries("list '" + query + "' page " + page, () -> client.list(query, page, fileType));
  }

  public List<FileInfo> fetchFiles(String reference) {
    return withRetries("files of " + reference, () -> client.listFiles(reference));
  }

  private <T> T withRetries(String operation, RequestGate.CatalogCall<T> call) {
    CatalogException last = null;
    for (int attempt = 0; attempt <= maxRetries; attempt++) {
      try {
        return gate.pace(call);
      } catch (RateLimitedException e) {
        last = e;
        if (attempt < maxRetries) {
          Duration wait = exponentialBackoff(attempt);
          log.debug("Rate limited on {} (attempt {}), backing off {} ms", operation, attempt + 1, wait.toMillis());
          pause(wait);
        }
      } catch (CatalogException e) {
        if (!e.isRetryable()) {
          throw e;
        }
        last = e;
        if (attempt < maxRetries) {
          Duration wait = linearBackoff(attempt);
          log.debug("Transient failure on {} (attempt {}): {}; retrying in {} ms",
              operation, attempt + 1, e.getMessage(), wait.toMillis());
          pause(wait);
        }
      }
    }
    log.warn("Retries exhausted for {} after {} attempts", operation, maxRetries + 1);
    throw new RetriesExhaustedException(operation, maxRetries + 1, last);
  }

  Duration exponentialBackoff(int attempt) {
    long millis = backoffBase.toMillis() * (1L << Math.min(attempt, 30))
        + Math.round(random.getAsDouble() * 1000.0);
    return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
  }

  Duration linearBackoff(int attempt) {
    return backoffBase.multipliedBy(attempt + 1L);
  }

  private void pause(Duration wait) {
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SearchCancelledException("Interrupted during backoff", e);
    }
  }
}
