package com.sidexkit.engine.executor.venue.hyperliquid;

import com.sidexkit.engine.error.MarketNotFoundException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

final class HyperliquidSymbols {

  private static final List<String> QUOTE_SUFFIXES = List.of("PERP", "USDT", "USDC", "USD");

  private HyperliquidSymbols() {
  }

  /**
   * Names to try against the universe, most literal first: the symbol as given, then the
   * base coin with separators and quote suffixes removed.
   */
  static Set<String> candidates(String symbol) {
    Set<String> out = new LinkedHashSet<>();
    String trimmed = symbol == null ? "" : symbol.trim();
    if (!trimmed.isEmpty()) {
      out.add(trimmed);
    }
    String base = trimmed.toUpperCase(Locale.ROOT).replaceAll("\\s", "");
    int sep = indexOfSeparator(base);
    if (sep > 0) {
      base = base.substring(0, sep);
    }
    boolean stripped = true;
    while (stripped) {
      stripped = false;
      for (String suffix : QUOTE_SUFFIXES) {
        if (base.length() > suffix.length() && base.endsWith(suffix)) {
          base = base.substring(0, base.length() - suffix.length());
          stripped = true;
          break;
        }
      }
    }
    if (!base.isEmpty()) {
      out.add(base);
    }
    return out;
  }

  static HyperliquidAsset resolve(String symbol, List<HyperliquidAsset> universe) {
    for (String candidate : candidates(symbol)) {
      for (HyperliquidAsset asset : universe) {
        if (asset.name().equalsIgnoreCase(candidate)) {
          return asset;
        }
      }
    }
    throw new MarketNotFoundException(symbol, "asset not found: " + symbol);
  }

  private static int indexOfSeparator(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '/' || c == '-' || c == '_' || c == ':') {
        return i;
      }
    }
    return -1;
  }
}
