package com.sidexkit.engine.executor.venue.jupiter;

import com.sidexkit.engine.domain.Quote;

import java.math.BigDecimal;

/**
 * @param transaction unsigned swap transaction as built by the aggregator
 */
public record JupiterSwapOrder(SolanaMarket market, Quote quote, SolanaTransaction transaction) {

  public BigDecimal inputAmount() {
    return new BigDecimal(quote.inputAmount()).movePointLeft(market.inputDecimals());
  }

  public BigDecimal outputAmount() {
    return new BigDecimal(quote.outputAmount()).movePointLeft(market.outputDecimals());
  }
}
