package com.sidexkit.engine.executor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sidexkit.engine.crypto.NonceSource;
import com.sidexkit.engine.executor.config.ExecutorProperties;
import com.sidexkit.engine.executor.coordinator.ExecutionCoordinator;
import com.sidexkit.engine.executor.venue.VenueAdapter;
import com.sidexkit.engine.executor.venue.VenueRegistry;
import com.sidexkit.engine.ledger.LedgerSink;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

public final class VenueTestSupport {

  public static final ObjectMapper MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private VenueTestSupport() {
  }

  public static RestClient restClient(MockWebServer server) {
    return RestClient.create(server.url("/").toString());
  }

  public static NonceSource nonces() {
    return new NonceSource(Clock.systemUTC());
  }

  public static ExecutorProperties properties(String bybitUrl, String hyperliquidUrl, String jupiterUrl, String rpcUrl,
                                              Duration confirmTimeout, Duration pollInterval) {
    return new ExecutorProperties(
        null,
        new ExecutorProperties.Bybit(bybitUrl, null, null),
        new ExecutorProperties.Hyperliquid(hyperliquidUrl, null, null, null, null),
        new ExecutorProperties.Jupiter(jupiterUrl, rpcUrl, null, null, null, null, null, null, confirmTimeout, pollInterval, null),
        null,
        null
    );
  }

  public static ExecutionCoordinator coordinator(VenueAdapter<?, ?, ?> adapter, LedgerSink ledger) {
    return new ExecutionCoordinator(
        new VenueRegistry(List.of(adapter)),
        intent -> intent.credentials(),
        ledger,
        MAPPER,
        Clock.systemUTC()
    );
  }

  public static MockResponse json(String body) {
    return new MockResponse()
        .setHeader("Content-Type", "application/json")
        .setBody(body);
  }
}
