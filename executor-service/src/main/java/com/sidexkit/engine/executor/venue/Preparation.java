package com.sidexkit.engine.executor.venue;

import java.math.BigDecimal;

/**
 * Result of the prepare stage.
 *
 * @param quantity      order quantity in the venue's wire format, {@code null} when skipped
 * @param displayAmount the same quantity in human units
 * @param skipped       nothing to do; the execution completes successfully without submitting
 * @param message       reason for a skip
 */
public record Preparation(String quantity, BigDecimal displayAmount, boolean skipped, String message) {

  public static Preparation proceed(String quantity, BigDecimal displayAmount) {
    return new Preparation(quantity, displayAmount, false, null);
  }

  public static Preparation skip(String message) {
    return new Preparation(null, BigDecimal.ZERO, true, message);
  }
}
