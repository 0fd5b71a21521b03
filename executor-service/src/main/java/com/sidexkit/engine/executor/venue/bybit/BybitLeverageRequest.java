package com.sidexkit.engine.executor.venue.bybit;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"category", "symbol", "buyLeverage", "sellLeverage"})
public record BybitLeverageRequest(String category, String symbol, String buyLeverage, String sellLeverage) {
}
