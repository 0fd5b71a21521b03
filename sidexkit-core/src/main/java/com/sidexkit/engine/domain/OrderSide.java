package com.sidexkit.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OrderSide {
  BUY,
  SELL;

  public boolean isBuy() {
    return this == BUY;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static OrderSide fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("side is required");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "buy", "long" -> BUY;
      case "sell", "short" -> SELL;
      default -> throw new IllegalArgumentException("Unknown side: " + value);
    };
  }
}
