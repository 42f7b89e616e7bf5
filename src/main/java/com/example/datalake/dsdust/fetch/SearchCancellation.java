package com.example.datalake.dsdust.fetch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancel flag for one aggregation. Checked between page fetches and between expanded
 * queries, so work already accumulated is kept.
 */
public final class SearchCancellation {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public static SearchCancellation create() {
    return new SearchCancellation();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get() || Thread.currentThread().isInterrupted();
  }
}
