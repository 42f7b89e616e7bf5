package com.example.datalake.dsdust.catalog;

/** A failure that will not go away on retry, e.g. bad credentials or a malformed request. */
public class FatalCatalogException extends CatalogException {

  public FatalCatalogException(String message) {
    super(message);
  }

  public FatalCatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
