package com.sidexkit.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Venue {
  BYBIT("bybit"),
  HYPERLIQUID("hyperliquid"),
  SOLANA_JUPITER("solana_jupiter");

  private final String id;

  Venue(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  @JsonCreator
  public static Venue fromId(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("venue is required");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (Venue venue : values()) {
      if (venue.id.equals(normalized) || venue.name().equalsIgnoreCase(normalized)) {
        return venue;
      }
    }
    if ("jupiter".equals(normalized) || "solana".equals(normalized)) {
      return SOLANA_JUPITER;
    }
    throw new IllegalArgumentException("Unknown venue: " + value);
  }
}
