package com.sidexkit.engine.executor.venue.jupiter;

import com.sidexkit.engine.crypto.Ed25519Keypair;
import com.sidexkit.engine.error.InvalidCredentialsException;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a wallet secret in hex, base58 or JSON byte-array form into a signing keypair. The
 * first decoder whose bytes form a valid 32-byte seed or 64-byte secret key wins.
 */
public final class SolanaKeyParser {

  private SolanaKeyParser() {
  }

  public static Ed25519Keypair parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidCredentialsException("invalid key format: empty private key");
    }
    String trimmed = raw.trim();
    List<KeyDecodeAttempt> attempts = new ArrayList<>();
    for (SolanaKeyDecoder decoder : SolanaKeyDecoder.values()) {
      KeyDecodeAttempt attempt = decoder.decode(trimmed);
      if (attempt.succeeded()) {
        try {
          return Ed25519Keypair.fromSecretKey(attempt.bytes());
        } catch (IllegalArgumentException e) {
          attempt = KeyDecodeAttempt.failure(decoder.name(), e.getMessage());
        }
      }
      attempts.add(attempt);
    }
    throw new InvalidCredentialsException("invalid key format: " + attempts);
  }
}
