package com.sidexkit.engine.domain;

public enum ExecutionStatus {
  SUCCEEDED,
  FAILED,
  /**
   * The request was broadcast but settlement could not be observed in time; it may still land.
   */
  UNKNOWN_OUTCOME
}
