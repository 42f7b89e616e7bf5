package com.example.datalake.dsdust.catalog;

/** A catalog entry missing a field every {@code DatasetRecord} needs. */
public class MalformedRecordException extends CatalogException {

  public MalformedRecordException(String message) {
    super(message);
  }
}
