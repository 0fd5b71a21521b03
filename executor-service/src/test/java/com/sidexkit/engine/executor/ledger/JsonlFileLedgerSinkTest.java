package com.sidexkit.engine.executor.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.sidexkit.engine.domain.ExecutionResult;
import com.sidexkit.engine.domain.ExecutionStage;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.ledger.VenueTraceEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static com.sidexkit.engine.executor.VenueTestSupport.MAPPER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class JsonlFileLedgerSinkTest {

  @TempDir
  Path dir;

  @Test
  void tracesGoToOneFilePerVenue() throws Exception {
    JsonlFileLedgerSink sink = new JsonlFileLedgerSink(dir.resolve("ledger"), "trades.jsonl", MAPPER);

    sink.trace(trace(Venue.BYBIT, "request"));
    sink.trace(trace(Venue.BYBIT, "response"));
    sink.trace(trace(Venue.HYPERLIQUID, "request"));

    List<String> bybit = Files.readAllLines(sink.traceFile("bybit"));
    assertThat(bybit).hasSize(2);
    assertThat(MAPPER.readTree(bybit.get(1)).path("event").asText()).isEqualTo("response");
    assertThat(sink.traceFile("bybit").getFileName().toString()).isEqualTo("bybit_debug.log");
    assertThat(Files.readAllLines(sink.traceFile("hyperliquid"))).hasSize(1);
    assertThat(sink.tradesFile()).doesNotExist();
  }

  @Test
  void resultsAreAppendedAsJsonLines() throws Exception {
    JsonlFileLedgerSink sink = new JsonlFileLedgerSink(dir, "trades.jsonl", MAPPER);

    sink.append(result("a", true));
    sink.append(result("b", false));

    List<String> lines = Files.readAllLines(dir.resolve("trades.jsonl"));
    assertThat(lines).hasSize(2);
    JsonNode first = MAPPER.readTree(lines.get(0));
    assertThat(first.path("intentId").asText()).isEqualTo("a");
    assertThat(first.path("venue").asText()).isEqualTo("solana_jupiter");
    assertThat(first.path("stage").asText()).isEqualTo("complete");
    assertThat(first.path("txHash").asText()).isEqualTo("sig-a");
    assertThat(MAPPER.readTree(lines.get(1)).path("success").asBoolean()).isFalse();
  }

  @Test
  void unwritableDirectoryIsLoggedNotThrown() throws Exception {
    Path notADirectory = Files.writeString(dir.resolve("occupied"), "x");
    JsonlFileLedgerSink sink = new JsonlFileLedgerSink(notADirectory, "trades.jsonl", MAPPER);

    assertThatCode(() -> {
      sink.append(result("a", true));
      sink.trace(trace(Venue.BYBIT, "request"));
    }).doesNotThrowAnyException();
  }

  private static VenueTraceEntry trace(Venue venue, String event) {
    return new VenueTraceEntry(Instant.parse("2024-01-01T00:00:00Z"), venue, "intent-1", ExecutionStage.SUBMIT, event,
        MAPPER.createObjectNode().put("path", "/v5/order/create"));
  }

  private static ExecutionResult result(String id, boolean success) {
    return ExecutionResult.builder()
        .intentId(id)
        .venue(Venue.SOLANA_JUPITER)
        .symbol("BONK")
        .success(success)
        .stage(success ? ExecutionStage.COMPLETE : ExecutionStage.SUBMIT)
        .txHash("sig-" + id)
        .executedAmount(BigDecimal.ONE)
        .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
        .build();
  }
}
