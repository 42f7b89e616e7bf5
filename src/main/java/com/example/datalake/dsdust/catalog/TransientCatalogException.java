package com.example.datalake.dsdust.catalog;

/** Timeouts, connection resets and 5xx responses. */
public class TransientCatalogException extends CatalogException {

  public TransientCatalogException(String message) {
    super(message);
  }

  public TransientCatalogException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
