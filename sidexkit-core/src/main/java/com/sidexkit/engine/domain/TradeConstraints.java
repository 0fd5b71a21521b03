package com.sidexkit.engine.domain;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Execution constraints attached to an intent.
 *
 * @param maxSlippageBps slippage tolerance in basis points, {@code null} for the venue default
 * @param timeLimit      upper bound on the settlement wait, {@code null} for the configured default
 * @param minLiquidity   informational only; liquidity checks belong to the caller
 */
public record TradeConstraints(
    Integer maxSlippageBps,
    Duration timeLimit,
    BigDecimal minLiquidity
) {

  public static TradeConstraints none() {
    return new TradeConstraints(null, null, null);
  }
}
