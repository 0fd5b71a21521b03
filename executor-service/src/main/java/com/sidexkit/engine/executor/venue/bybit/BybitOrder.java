package com.sidexkit.engine.executor.venue.bybit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Body of {@code POST /v5/order/create}. Serialized once; the signature covers the exact bytes sent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"category", "symbol", "side", "orderType", "qty", "price", "timeInForce", "reduceOnly", "orderLinkId"})
public record BybitOrder(
    String category,
    String symbol,
    String side,
    String orderType,
    String qty,
    String price,
    String timeInForce,
    Boolean reduceOnly,
    String orderLinkId
) {
}
