package com.sidexkit.engine.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.sidexkit.engine.domain.ExecutionStage;
import com.sidexkit.engine.domain.Venue;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VenueTraceEntry(
    Instant ts,
    Venue venue,
    String intentId,
    ExecutionStage stage,
    String event,
    JsonNode payload
) {
}
