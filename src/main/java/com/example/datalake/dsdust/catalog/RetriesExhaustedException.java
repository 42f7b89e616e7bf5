package com.example.datalake.dsdust.catalog;

/** Raised once every allowed attempt for a single call has failed. */
public class RetriesExhaustedException extends CatalogException {

  private final int attempts;

  public RetriesExhaustedException(String operation, int attempts, CatalogException last) {
    super("Gave up on " + operation + " after " + attempts + " attempts: " + last.getMessage(), last);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
