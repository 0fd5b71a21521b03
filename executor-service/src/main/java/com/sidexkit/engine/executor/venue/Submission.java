package com.sidexkit.engine.executor.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;

/**
 * Venue acknowledgement of a submitted order.
 *
 * @param expectedAmount amount submitted, in human units
 * @param expectedPrice  price submitted or quoted, {@code null} when unknown
 */
public record Submission(
    String orderId,
    String txHash,
    JsonNode response,
    BigDecimal expectedAmount,
    BigDecimal expectedPrice,
    ObjectNode details
) {
}
