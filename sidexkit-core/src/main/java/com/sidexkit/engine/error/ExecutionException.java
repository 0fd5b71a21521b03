package com.sidexkit.engine.error;

import com.sidexkit.engine.domain.ErrorKind;
import com.sidexkit.engine.domain.ExecutionError;

/**
 * Base for failures the execution coordinator converts into a failed result.
 */
public abstract class ExecutionException extends RuntimeException {

  protected ExecutionException(String message) {
    super(message);
  }

  protected ExecutionException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract ErrorKind kind();

  /**
   * Venue error code, when the venue supplied one.
   */
  public String code() {
    return null;
  }

  public ExecutionError toError() {
    return ExecutionError.of(kind(), code(), getMessage());
  }
}
