package com.sidexkit.engine.error;

import com.sidexkit.engine.domain.ErrorKind;

public class InvalidIntentException extends ExecutionException {

  public InvalidIntentException(String message) {
    super(message);
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.INPUT;
  }
}
