package com.sidexkit.engine.settlement;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Terminal outcome reported by a venue adapter's confirm step.
 *
 * @param state      one of the terminal {@link SettlementState}s
 * @param errorCode  venue error code for FAILED settlements
 * @param error      human-readable failure for FAILED or TIMED_OUT settlements
 * @param details    venue-specific identifiers surfaced on the execution result
 */
@Builder(toBuilder = true)
public record Settlement(
    SettlementState state,
    String txHash,
    String orderId,
    BigDecimal executedAmount,
    BigDecimal executedPrice,
    BigDecimal fees,
    BigDecimal slippage,
    String errorCode,
    String error,
    ObjectNode details
) {

  public Settlement {
    if (state == null || !state.isTerminal()) {
      throw new IllegalArgumentException("Settlement requires a terminal state, got " + state);
    }
  }

  public boolean confirmed() {
    return state == SettlementState.CONFIRMED;
  }
}
