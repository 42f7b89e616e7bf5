package com.example.datalake.dsdust.catalog;

/** The catalog reported the caller is over quota (HTTP 429). */
public class RateLimitedException extends CatalogException {

  public RateLimitedException(String message) {
    super(message);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
