package com.sidexkit.engine.executor.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sidexkit.engine.domain.ExecutionResult;
import org.springframework.http.HttpStatus;

/**
 * Flat JSON receipt for HTTP callers and the status code that goes with it.
 */
final class ExecutionReceipts {

  private ExecutionReceipts() {
  }

  static HttpStatus status(ExecutionResult result) {
    if (result.isUnknownOutcome()) {
      return HttpStatus.ACCEPTED;
    }
    if (result.success()) {
      return HttpStatus.OK;
    }
    if (result.error() == null) {
      return HttpStatus.BAD_GATEWAY;
    }
    return switch (result.error().kind()) {
      case INPUT, RESOLUTION -> HttpStatus.BAD_REQUEST;
      case VENUE_REJECTION, SETTLEMENT_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
      case TRANSPORT, SETTLEMENT_TIMEOUT, INTERNAL -> HttpStatus.BAD_GATEWAY;
    };
  }

  static ObjectNode receipt(ExecutionResult result, ObjectMapper objectMapper) {
    ObjectNode node = objectMapper.createObjectNode()
        .put("success", result.success())
        .put("status", result.status().name())
        .put("intentId", result.intentId())
        .put("venue", result.venue() == null ? null : result.venue().id())
        .put("symbol", result.symbol())
        .put("stage", result.stage() == null ? null : result.stage().wireName());
    putIfPresent(node, "orderId", result.orderId());
    putIfPresent(node, "txHash", result.txHash());
    putIfPresent(node, "message", result.message());
    node.put("executedAmount", result.executedAmount());
    node.put("executedPrice", result.executedPrice());
    node.put("executionTimeMillis", result.executionTimeMillis());
    JsonNode details = result.details();
    if (details != null && details.isObject()) {
      details.fields().forEachRemaining(e -> {
        if (!node.has(e.getKey())) {
          node.set(e.getKey(), e.getValue());
        }
      });
    }
    if (result.error() != null) {
      node.set("error", objectMapper.valueToTree(result.error()));
    }
    if (!result.warnings().isEmpty()) {
      node.set("warnings", objectMapper.valueToTree(result.warnings()));
    }
    return node;
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }
}
