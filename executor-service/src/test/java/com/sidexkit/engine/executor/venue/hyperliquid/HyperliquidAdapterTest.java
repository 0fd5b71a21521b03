package com.sidexkit.engine.executor.venue.hyperliquid;

import com.fasterxml.jackson.databind.JsonNode;
import com.sidexkit.engine.domain.ErrorKind;
import com.sidexkit.engine.domain.ExecutionResult;
import com.sidexkit.engine.domain.ExecutionStage;
import com.sidexkit.engine.domain.OrderSide;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.domain.WalletCredentials;
import com.sidexkit.engine.executor.VenueTestSupport;
import com.sidexkit.engine.executor.config.ExecutorProperties;
import com.sidexkit.engine.executor.coordinator.ExecutionCoordinator;
import com.sidexkit.engine.ledger.InMemoryLedgerSink;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

import static com.sidexkit.engine.executor.VenueTestSupport.MAPPER;
import static com.sidexkit.engine.executor.VenueTestSupport.json;
import static org.assertj.core.api.Assertions.assertThat;

class HyperliquidAdapterTest {

  private static final WalletCredentials WALLET =
      new WalletCredentials("0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318");
  private static final String META =
      "{\"universe\":[{\"name\":\"BTC\",\"szDecimals\":5},{\"name\":\"ETH\",\"szDecimals\":4}]}";
  private static final String MIDS = "{\"BTC\":\"65000.5\",\"ETH\":\"3000.0\",\"@1\":\"not-a-number\"}";

  private MockWebServer server;
  private InMemoryLedgerSink ledger;
  private ExecutionCoordinator coordinator;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    ExecutorProperties properties = VenueTestSupport.properties(null, server.url("/").toString(), null, null, null, null);
    HyperliquidApiClient client = new HyperliquidApiClient(VenueTestSupport.restClient(server), MAPPER);
    ledger = new InMemoryLedgerSink();
    coordinator = VenueTestSupport.coordinator(new HyperliquidAdapter(client, VenueTestSupport.nonces(), properties), ledger);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void placesIocOrderThroughTheMidAndReportsTheFill() throws Exception {
    server.enqueue(json(META));
    server.enqueue(json(MIDS));
    server.enqueue(json("{\"status\":\"ok\",\"response\":{\"type\":\"order\",\"data\":{\"statuses\":"
        + "[{\"filled\":{\"totalSz\":\"0.001\",\"avgPx\":\"65010.0\",\"oid\":77747314}}]}}}"));

    ExecutionResult result = coordinator.execute(
        TradeIntent.open(Venue.HYPERLIQUID, "BTC/USDT", OrderSide.BUY, new BigDecimal("0.0012345"), WALLET));

    assertThat(result.success()).isTrue();
    assertThat(result.orderId()).isEqualTo("77747314");
    assertThat(result.executedAmount()).isEqualByComparingTo("0.001");
    assertThat(result.executedPrice()).isEqualByComparingTo("65010.0");
    assertThat(result.details().path("statuses").isArray()).isTrue();

    RecordedRequest meta = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(meta.getPath()).isEqualTo("/info");
    assertThat(MAPPER.readTree(meta.getBody().readUtf8()).path("type").asText()).isEqualTo("meta");
    server.takeRequest(1, TimeUnit.SECONDS);
    RecordedRequest exchange = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(exchange.getPath()).isEqualTo("/exchange");

    JsonNode body = MAPPER.readTree(exchange.getBody().readUtf8());
    JsonNode order = body.path("action").path("orders").path(0);
    assertThat(body.path("action").path("type").asText()).isEqualTo("order");
    assertThat(body.path("action").path("grouping").asText()).isEqualTo("na");
    assertThat(order.path("a").asInt()).isZero();
    assertThat(order.path("b").asBoolean()).isTrue();
    assertThat(order.path("p").asText()).isEqualTo("68251");
    assertThat(order.path("s").asText()).isEqualTo("0.00123");
    assertThat(order.path("t").path("limit").path("tif").asText()).isEqualTo("Ioc");
    assertThat(body.path("nonce").asLong()).isPositive();
    assertThat(body.path("signature").path("r").asText()).startsWith("0x");
    assertThat(body.has("vaultAddress")).isTrue();
    assertThat(body.path("vaultAddress").isNull()).isTrue();
  }

  @Test
  void explicitPriceSkipsMidLookupAndLeverageFailureIsAWarning() throws Exception {
    server.enqueue(json(META));
    server.enqueue(json("{\"status\":\"err\",\"response\":\"Cannot set leverage above max\"}"));
    server.enqueue(json("{\"status\":\"ok\",\"response\":{\"type\":\"order\",\"data\":{\"statuses\":"
        + "[{\"resting\":{\"oid\":42}}]}}}"));
    TradeIntent intent = TradeIntent.open(Venue.HYPERLIQUID, "ETHUSDT", OrderSide.SELL, new BigDecimal("0.5"), WALLET)
        .withLeverage(3)
        .withPrice(new BigDecimal("2999.5"));

    ExecutionResult result = coordinator.execute(intent);

    assertThat(result.success()).isTrue();
    assertThat(result.orderId()).isEqualTo("42");
    assertThat(result.executedPrice()).isEqualByComparingTo("2999.5");
    assertThat(result.warnings()).singleElement().asString().contains("leverage not set");

    server.takeRequest(1, TimeUnit.SECONDS);
    JsonNode leverage = MAPPER.readTree(server.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8());
    assertThat(leverage.path("action").path("type").asText()).isEqualTo("updateLeverage");
    assertThat(leverage.path("action").path("asset").asInt()).isEqualTo(1);
    assertThat(leverage.path("action").path("isCross").asBoolean()).isTrue();
    assertThat(leverage.path("action").path("leverage").asInt()).isEqualTo(3);
    JsonNode order = MAPPER.readTree(server.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8());
    assertThat(order.path("nonce").asLong()).isGreaterThan(leverage.path("nonce").asLong());
    assertThat(server.getRequestCount()).isEqualTo(3);
  }

  @Test
  void unknownAssetStopsAtResolution() {
    server.enqueue(json(META));

    ExecutionResult result = coordinator.execute(
        TradeIntent.open(Venue.HYPERLIQUID, "DOGE", OrderSide.BUY, BigDecimal.ONE, WALLET));

    assertThat(result.error().kind()).isEqualTo(ErrorKind.RESOLUTION);
    assertThat(result.stage()).isEqualTo(ExecutionStage.RESOLVE_MARKET);
    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  @Test
  void perOrderErrorWithoutAnOrderIsARejection() {
    server.enqueue(json(META));
    server.enqueue(json(MIDS));
    server.enqueue(json("{\"status\":\"ok\",\"response\":{\"type\":\"order\",\"data\":{\"statuses\":"
        + "[{\"error\":\"Order could not immediately match against any resting orders.\"}]}}}"));

    ExecutionResult result = coordinator.execute(
        TradeIntent.open(Venue.HYPERLIQUID, "ETH", OrderSide.BUY, new BigDecimal("0.1"), WALLET));

    assertThat(result.success()).isFalse();
    assertThat(result.error().kind()).isEqualTo(ErrorKind.VENUE_REJECTION);
    assertThat(result.error().message()).contains("could not immediately match");
  }

  @Test
  void malformedKeyFailsWithoutNetworkCalls() {
    ExecutionResult result = coordinator.execute(
        TradeIntent.open(Venue.HYPERLIQUID, "BTC", OrderSide.BUY, BigDecimal.ONE, new WalletCredentials("0x1234")));

    assertThat(result.error().kind()).isEqualTo(ErrorKind.INPUT);
    assertThat(result.error().message()).contains("invalid key format").doesNotContain("1234");
    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void sizeRoundingToZeroIsAnInputError() {
    server.enqueue(json(META));

    ExecutionResult result = coordinator.execute(
        TradeIntent.open(Venue.HYPERLIQUID, "BTC", OrderSide.BUY, new BigDecimal("0.000001"), WALLET));

    assertThat(result.error().kind()).isEqualTo(ErrorKind.INPUT);
    assertThat(result.stage()).isEqualTo(ExecutionStage.PREPARE);
  }
}
