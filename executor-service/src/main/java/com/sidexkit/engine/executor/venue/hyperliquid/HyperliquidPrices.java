package com.sidexkit.engine.executor.venue.hyperliquid;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Tick and lot formatting for perpetuals: prices carry at most five significant figures and
 * {@code 6 - szDecimals} decimals, sizes at most {@code szDecimals} decimals.
 */
final class HyperliquidPrices {

  private static final int MAX_SIGNIFICANT_FIGURES = 5;
  private static final int MAX_PERP_DECIMALS = 6;

  private HyperliquidPrices() {
  }

  static BigDecimal marketable(BigDecimal mid, boolean isBuy, BigDecimal slippage) {
    BigDecimal factor = isBuy ? BigDecimal.ONE.add(slippage) : BigDecimal.ONE.subtract(slippage);
    return mid.multiply(factor);
  }

  static String formatPrice(BigDecimal price, int szDecimals) {
    BigDecimal rounded = price.round(new MathContext(MAX_SIGNIFICANT_FIGURES, RoundingMode.HALF_UP));
    int maxDecimals = Math.max(0, MAX_PERP_DECIMALS - szDecimals);
    if (rounded.scale() > maxDecimals) {
      rounded = rounded.setScale(maxDecimals, RoundingMode.HALF_UP);
    }
    return toWire(rounded);
  }

  static String formatSize(BigDecimal amount, int szDecimals) {
    return toWire(amount.setScale(szDecimals, RoundingMode.DOWN));
  }

  private static String toWire(BigDecimal value) {
    if (value.signum() == 0) {
      return "0";
    }
    return value.stripTrailingZeros().toPlainString();
  }
}
