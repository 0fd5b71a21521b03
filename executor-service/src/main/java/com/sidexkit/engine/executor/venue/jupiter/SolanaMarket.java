package com.sidexkit.engine.executor.venue.jupiter;

import com.sidexkit.engine.domain.MarketRef;

/**
 * A swap direction. {@code tokenMint} is the traded token, whichever side of the swap it is on.
 */
public record SolanaMarket(
    String tokenMint,
    String inputMint,
    String outputMint,
    int inputDecimals,
    int outputDecimals
) implements MarketRef {

  @Override
  public String venueId() {
    return tokenMint;
  }

  public boolean buysToken() {
    return tokenMint.equals(outputMint);
  }
}
