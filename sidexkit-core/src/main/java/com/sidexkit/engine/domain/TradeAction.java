package com.sidexkit.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * OPEN trades {@code amount} in the intent's direction; CLOSE liquidates the whole
 * position held for the intent's symbol.
 */
public enum TradeAction {
  OPEN,
  CLOSE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TradeAction fromString(String value) {
    if (value == null || value.isBlank()) {
      return OPEN;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "open", "trade" -> OPEN;
      case "close", "close_position" -> CLOSE;
      default -> throw new IllegalArgumentException("Unknown action: " + value);
    };
  }
}
