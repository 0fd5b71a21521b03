package com.sidexkit.engine.error;

import com.sidexkit.engine.domain.ErrorKind;

/**
 * Key material is missing or malformed. Raised before any network call.
 */
public class InvalidCredentialsException extends ExecutionException {

  public InvalidCredentialsException(String message) {
    super(message);
  }

  public InvalidCredentialsException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.INPUT;
  }
}
