package com.example.datalake.dsdust.fetch;

/** Thrown from inside a fetch when the running search was cancelled or its thread interrupted. */
public class SearchCancelledException extends RuntimeException {

  public SearchCancelledException(String message) {
    super(message);
  }

  public SearchCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
