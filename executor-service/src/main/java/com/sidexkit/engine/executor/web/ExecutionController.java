package com.sidexkit.engine.executor.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sidexkit.engine.domain.ExecutionResult;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.executor.coordinator.ExecutionCoordinator;
import com.sidexkit.engine.ledger.InMemoryLedgerSink;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/executions")
@Validated
@RequiredArgsConstructor
@Slf4j
public class ExecutionController {

  private final @NonNull ExecutionCoordinator coordinator;
  private final @NonNull InMemoryLedgerSink recentExecutions;
  private final @NonNull ObjectMapper objectMapper;

  @PostMapping
  public ResponseEntity<ObjectNode> execute(@Valid @RequestBody ExecutionRequest request) {
    log.info("api /executions venue={} action={} symbol={} side={} amount={} leverage={}",
        request.venue(), request.action(), request.symbol(), request.side(), request.amount(), request.leverage());
    TradeIntent intent = request.toIntent();
    ExecutionResult result = coordinator.execute(intent);
    return ResponseEntity.status(ExecutionReceipts.status(result))
        .body(ExecutionReceipts.receipt(result, objectMapper));
  }

  @GetMapping("/recent")
  public ResponseEntity<List<ExecutionResult>> recent(
      @RequestParam(name = "limit", required = false, defaultValue = "50") @Min(1) @Max(1000) int limit
  ) {
    return ResponseEntity.ok(recentExecutions.recent(limit));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
    log.info("api /executions rejected request error={}", e.getMessage());
    return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
  }
}
