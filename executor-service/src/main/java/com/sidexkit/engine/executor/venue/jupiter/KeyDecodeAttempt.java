package com.sidexkit.engine.executor.venue.jupiter;

/**
 * Outcome of one decoder on a raw key string. Failures carry a reason but never the input.
 */
public record KeyDecodeAttempt(String decoder, byte[] bytes, String failure) {

  public static KeyDecodeAttempt success(String decoder, byte[] bytes) {
    return new KeyDecodeAttempt(decoder, bytes, null);
  }

  public static KeyDecodeAttempt failure(String decoder, String reason) {
    return new KeyDecodeAttempt(decoder, null, reason);
  }

  public boolean succeeded() {
    return bytes != null;
  }

  @Override
  public String toString() {
    return succeeded() ? decoder + ": ok" : decoder + ": " + failure;
  }
}
