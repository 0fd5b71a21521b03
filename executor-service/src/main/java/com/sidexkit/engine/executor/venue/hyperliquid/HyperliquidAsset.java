package com.sidexkit.engine.executor.venue.hyperliquid;

import com.sidexkit.engine.domain.MarketRef;

/**
 * Perpetual from the {@code meta} universe; {@code index} is the asset id used on the wire.
 */
public record HyperliquidAsset(int index, String name, int szDecimals) implements MarketRef {

  @Override
  public String venueId() {
    return Integer.toString(index);
  }
}
