package com.sidexkit.engine.executor.venue.bybit;

import com.sidexkit.engine.domain.MarketRef;
import com.sidexkit.engine.error.MarketNotFoundException;

import java.util.Locale;

public record BybitSymbol(String symbol) implements MarketRef {

  /**
   * {@code eth/usdt}, {@code ETH-USDT} and {@code ETH USDT} all become {@code ETHUSDT}.
   */
  public static BybitSymbol normalize(String raw) {
    String symbol = raw == null ? "" : raw.replaceAll("[\\s/_\\-]", "").toUpperCase(Locale.ROOT);
    if (symbol.isEmpty() || !symbol.chars().allMatch(Character::isLetterOrDigit)) {
      throw new MarketNotFoundException(raw, "not a bybit symbol: " + raw);
    }
    return new BybitSymbol(symbol);
  }

  @Override
  public String venueId() {
    return symbol;
  }
}
