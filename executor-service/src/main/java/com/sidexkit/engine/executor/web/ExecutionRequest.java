package com.sidexkit.engine.executor.web;

import com.sidexkit.engine.domain.OrderSide;
import com.sidexkit.engine.domain.TradeAction;
import com.sidexkit.engine.domain.TradeConstraints;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.Venue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Trade request accepted over HTTP. Credentials are never accepted on the wire; they come
 * from configuration.
 */
public record ExecutionRequest(
    @Size(max = 36) String id,
    @NotNull Venue venue,
    String action,
    @NotBlank String symbol,
    String side,
    @DecimalMin(value = "0", inclusive = false) BigDecimal amount,
    @Min(1) Integer leverage,
    @Positive BigDecimal price,
    Boolean reduceOnly,
    @Min(0) @Max(10_000) Integer maxSlippageBps,
    @Positive Long timeLimitMillis,
    BigDecimal minLiquidity
) {

  public TradeIntent toIntent() {
    TradeAction tradeAction = TradeAction.fromString(action);
    OrderSide orderSide = side == null || side.isBlank() ? null : OrderSide.fromString(side);
    TradeConstraints constraints = new TradeConstraints(
        maxSlippageBps,
        timeLimitMillis == null ? null : Duration.ofMillis(timeLimitMillis),
        minLiquidity
    );
    return new TradeIntent(id, venue, tradeAction, symbol, orderSide, amount, leverage, price,
        Boolean.TRUE.equals(reduceOnly), constraints, null);
  }
}
