package com.sidexkit.engine.domain;

/**
 * Venue-specific identity of a market, resolved from a human symbol for a single execution.
 */
public interface MarketRef {

  /**
   * Identifier as the venue knows it: pair string, asset index or mint address.
   */
  String venueId();
}
