package com.sidexkit.engine.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionError(
    ErrorKind kind,
    String code,
    String message,
    boolean retryable
) {

  public static ExecutionError of(ErrorKind kind, String code, String message) {
    return new ExecutionError(kind, code, message, kind.retryable());
  }
}
