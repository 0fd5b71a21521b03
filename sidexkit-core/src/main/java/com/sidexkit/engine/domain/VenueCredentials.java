package com.sidexkit.engine.domain;

/**
 * Per-venue secrets. Implementations must never expose secret material through
 * {@code toString()}.
 */
public sealed interface VenueCredentials permits ApiKeyCredentials, WalletCredentials {

  static String mask(String secret) {
    if (secret == null || secret.isBlank()) {
      return "<unset>";
    }
    String trimmed = secret.trim();
    if (trimmed.length() <= 8) {
      return "****";
    }
    return trimmed.substring(0, 4) + "****";
  }
}
