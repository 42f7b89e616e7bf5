package com.example.datalake.dsdust.catalog;

/** Base of every failure raised while talking to the dataset catalog. */
public class CatalogException extends RuntimeException {

  public CatalogException(String message) {
    super(message);
  }

  public CatalogException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Whether the request layer may try the same call again. */
  public boolean isRetryable() {
    return false;
  }
}
