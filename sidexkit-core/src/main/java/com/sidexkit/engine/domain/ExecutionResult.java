package com.sidexkit.engine.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of exactly one execution attempt, successful or not. Immutable; appended once to
 * the ledger.
 *
 * @param txHash    on-chain transaction signature, when the venue settles on-chain
 * @param orderId   venue order id, when the venue assigns one
 * @param slippage  venue-reported price impact percentage, when the venue quotes one
 * @param stage     furthest stage the execution reached
 * @param message   informational outcome note, e.g. a no-op close
 * @param details   venue-specific identifiers and raw acknowledgements
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(
    String intentId,
    Venue venue,
    String symbol,
    OrderSide side,
    TradeAction action,
    boolean success,
    ExecutionStatus status,
    String txHash,
    String orderId,
    BigDecimal executedAmount,
    BigDecimal executedPrice,
    BigDecimal fees,
    BigDecimal slippage,
    Long executionTimeMillis,
    ExecutionStage stage,
    String message,
    ExecutionError error,
    List<String> warnings,
    JsonNode details,
    Instant timestamp
) {

  public ExecutionResult {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    if (executedAmount == null) {
      executedAmount = BigDecimal.ZERO;
    }
    if (executedPrice == null) {
      executedPrice = BigDecimal.ZERO;
    }
    if (fees == null) {
      fees = BigDecimal.ZERO;
    }
    if (status == null) {
      status = success ? ExecutionStatus.SUCCEEDED : ExecutionStatus.FAILED;
    }
  }

  public boolean isUnknownOutcome() {
    return status == ExecutionStatus.UNKNOWN_OUTCOME;
  }

  /**
   * Short form for logs; never includes credentials.
   */
  public String summary() {
    StringBuilder sb = new StringBuilder()
        .append(venue == null ? "?" : venue.id())
        .append(' ').append(symbol)
        .append(" intent=").append(intentId)
        .append(" status=").append(status)
        .append(" stage=").append(stage == null ? null : stage.wireName());
    if (orderId != null) {
      sb.append(" orderId=").append(orderId);
    }
    if (txHash != null) {
      sb.append(" tx=").append(txHash);
    }
    if (error != null) {
      sb.append(" error=").append(error.kind()).append(':').append(error.message());
    }
    return sb.toString();
  }
}
