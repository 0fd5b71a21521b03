package com.sidexkit.engine.domain;

public enum ErrorKind {
  INPUT(false),
  RESOLUTION(false),
  VENUE_REJECTION(false),
  TRANSPORT(true),
  SETTLEMENT_FAILED(false),
  SETTLEMENT_TIMEOUT(true),
  INTERNAL(false);

  private final boolean retryable;

  ErrorKind(boolean retryable) {
    this.retryable = retryable;
  }

  /**
   * Whether a fresh execution of the same intent may succeed. Retrying always means a new
   * execution with a new nonce or timestamp, never a resend of the signed request.
   */
  public boolean retryable() {
    return retryable;
  }
}
