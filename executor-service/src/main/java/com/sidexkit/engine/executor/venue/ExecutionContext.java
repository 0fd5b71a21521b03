package com.sidexkit.engine.executor.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sidexkit.engine.domain.ExecutionStage;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.ledger.LedgerSink;
import com.sidexkit.engine.ledger.VenueTraceEntry;
import com.sidexkit.engine.settlement.SettlementState;
import com.sidexkit.engine.settlement.SettlementTracker;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one execution: the stage reached, the last venue response, warnings and
 * the settlement tracker. Owned by a single thread for the lifetime of the execution.
 */
@Slf4j
public final class ExecutionContext {

  private final TradeIntent intent;
  private final LedgerSink ledger;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Instant startedAt;
  private final List<String> warnings = new ArrayList<>();
  private final SettlementTracker settlement;

  private ExecutionStage stage = ExecutionStage.VALIDATE;
  private JsonNode lastResponse;
  private Submission submission;

  public ExecutionContext(TradeIntent intent, LedgerSink ledger, ObjectMapper objectMapper, Clock clock) {
    this.intent = intent;
    this.ledger = ledger;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.startedAt = clock.instant();
    this.settlement = new SettlementTracker(state -> trace("settlement", objectMapper.createObjectNode().put("state", state.name())));
  }

  public TradeIntent intent() {
    return intent;
  }

  public Venue venue() {
    return intent.venue();
  }

  public String intentId() {
    return intent.id();
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  public Clock clock() {
    return clock;
  }

  public ExecutionStage stage() {
    return stage;
  }

  public void enter(ExecutionStage next) {
    this.stage = next;
  }

  /**
   * Writes a debug trace entry. Never throws: a failing sink only costs the trace.
   */
  public void trace(String event, Object payload) {
    if (ledger == null || intent.venue() == null) {
      return;
    }
    try {
      JsonNode json = payload == null ? null : objectMapper.valueToTree(payload);
      ledger.trace(new VenueTraceEntry(clock.instant(), intent.venue(), intent.id(), stage, event, json));
    } catch (Exception e) {
      log.warn("trace write failed intent={} event={} error={}", intent.id(), event, e.toString());
    }
  }

  public void recordResponse(JsonNode response) {
    this.lastResponse = response;
  }

  public JsonNode lastResponse() {
    return lastResponse;
  }

  public void warn(String warning) {
    warnings.add(warning);
    trace("warning", objectMapper.createObjectNode().put("message", warning));
  }

  public List<String> warnings() {
    return List.copyOf(warnings);
  }

  public SettlementTracker settlement() {
    return settlement;
  }

  public void advance(SettlementState state) {
    settlement.advance(state);
  }

  public void recordSubmission(Submission submission) {
    this.submission = submission;
  }

  public Submission submission() {
    return submission;
  }

  public long elapsedMillis() {
    return Duration.between(startedAt, clock.instant()).toMillis();
  }
}
