package com.example.datalake.dsdust.fetch;

import static com.example.datalake.dsdust.support.StubCatalogClient.page;
import static com.example.datalake.dsdust.support.StubCatalogClient.raw;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.datalake.dsdust.catalog.FatalCatalogException;
import com.example.datalake.dsdust.catalog.RateLimitedException;
import com.example.datalake.dsdust.catalog.RetriesExhaustedException;
import com.example.datalake.dsdust.catalog.TransientCatalogException;
import com.example.datalake.dsdust.model.CatalogPage;
import com.example.datalake.dsdust.support.RecordingSleeper;
import com.example.datalake.dsdust.support.StubCatalogClient;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RateLimitedFetcherTest {

  private StubCatalogClient client;
  private RecordingSleeper backoff;
  private RateLimitedFetcher fetcher;

  @BeforeEach
  void setUp() {
    client = new StubCatalogClient();
    backoff = new RecordingSleeper();
    RequestGate gate = new RequestGate(1, Duration.ZERO, new RecordingSleeper());
    fetcher = new RateLimitedFetcher(client, gate, backoff, () -> 0.5,
        Duration.ofSeconds(1), Duration.ofSeconds(3), 3);
  }

  @Test
  void persistentRateLimitGivesUpAfterMaxRetriesPlusOneAttempts() {
    client.failList("finance",
        new RateLimitedException("429"), new RateLimitedException("429"),
        new RateLimitedException("429"), new RateLimitedException("429"));

    assertThatThrownBy(() -> fetcher.fetch("finance", 1, null))
        .isInstanceOfSatisfying(RetriesExhaustedException.class,
            e -> assertThat(e.getAttempts()).isEqualTo(4));

    assertThat(client.listCalls()).hasSize(4);
    // 1s + 0.5s jitter, 2s + 0.5s, then capped at 3s; no pause after the final attempt
    assertThat(backoff.millis()).containsExactly(1500L, 2500L, 3000L);
  }

  @Test
  void transientFailuresBackOffLinearlyAndRecover() {
    client.failList("finance", new TransientCatalogException("503"), new TransientCatalogException("reset"))
        .pages("finance", page(raw("a/one", "One")));

    CatalogPage result = fetcher.fetch("finance", 1, null);

    assertThat(result.records()).extracting("ref").containsExactly("a/one");
    assertThat(backoff.millis()).containsExactly(1000L, 2000L);
    assertThat(client.listCalls()).hasSize(3);
  }

  @Test
  void fatalFailureIsNotRetried() {
    client.failList("finance", new FatalCatalogException("401"));

    assertThatThrownBy(() -> fetcher.fetch("finance", 1, null))
        .isInstanceOf(FatalCatalogException.class);

    assertThat(client.listCalls()).hasSize(1);
    assertThat(backoff.sleeps()).isEmpty();
  }

  @Test
  void zeroRetriesMeansASingleAttempt() {
    RateLimitedFetcher once = new RateLimitedFetcher(client, new RequestGate(1, Duration.ZERO, d -> {}),
        backoff, Duration.ofSeconds(1), Duration.ofSeconds(3), 0);
    client.failList("x", new RateLimitedException("429"));

    assertThatThrownBy(() -> once.fetch("x", 1, null))
        .isInstanceOfSatisfying(RetriesExhaustedException.class,
            e -> assertThat(e.getAttempts()).isEqualTo(1));
    assertThat(backoff.sleeps()).isEmpty();
  }

  @Test
  void exponentialBackoffNeverExceedsMaxDelay() {
    for (int attempt = 0; attempt < 40; attempt++) {
      assertThat(fetcher.exponentialBackoff(attempt)).isLessThanOrEqualTo(Duration.ofSeconds(3));
    }
  }
}
