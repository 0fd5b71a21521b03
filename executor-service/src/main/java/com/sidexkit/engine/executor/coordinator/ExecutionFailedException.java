package com.sidexkit.engine.executor.coordinator;

import com.sidexkit.engine.domain.ExecutionResult;

/**
 * Raised by {@link ExecutionCoordinator#executeOrThrow} after the failed result has been recorded.
 */
public class ExecutionFailedException extends RuntimeException {

  private final transient ExecutionResult result;

  public ExecutionFailedException(ExecutionResult result) {
    super(result.summary());
    this.result = result;
  }

  public ExecutionResult result() {
    return result;
  }
}
