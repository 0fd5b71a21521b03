package com.sidexkit.engine.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Aggregator quote, consumed immediately to build a swap.
 *
 * @param inputAmount  input amount in base units
 * @param outputAmount expected output amount in base units
 * @param priceImpact  venue-reported price impact percentage
 * @param route        human-readable route labels
 * @param raw          quote document as returned by the aggregator
 */
public record Quote(
    BigInteger inputAmount,
    BigInteger outputAmount,
    BigDecimal priceImpact,
    String route,
    JsonNode raw
) {
}
