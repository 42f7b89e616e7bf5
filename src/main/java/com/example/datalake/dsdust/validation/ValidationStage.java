package com.example.datalake.dsdust.validation;

/** Identifies when a validator runs relative to the others. */
public enum ValidationStage {
  /** Clean-up of the raw terms before anything inspects them. */
  NORMALIZE,
  /** Checks that reject a request outright. */
  REQUIRE,
  /** Clamping of numeric limits to configured bounds. */
  LIMITS
}
