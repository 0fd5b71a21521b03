package com.sidexkit.engine.executor.venue.bybit;

import com.fasterxml.jackson.databind.JsonNode;
import com.sidexkit.engine.crypto.HmacSha256;
import com.sidexkit.engine.domain.ApiKeyCredentials;
import com.sidexkit.engine.domain.ErrorKind;
import com.sidexkit.engine.domain.ExecutionResult;
import com.sidexkit.engine.domain.ExecutionStage;
import com.sidexkit.engine.domain.ExecutionStatus;
import com.sidexkit.engine.domain.OrderSide;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.domain.WalletCredentials;
import com.sidexkit.engine.executor.VenueTestSupport;
import com.sidexkit.engine.executor.config.ExecutorProperties;
import com.sidexkit.engine.executor.coordinator.ExecutionCoordinator;
import com.sidexkit.engine.ledger.InMemoryLedgerSink;
import okhttp3.mockwebserver.MockResponse;
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

class BybitAdapterTest {

  private static final ApiKeyCredentials KEY = new ApiKeyCredentials("key123", "secret456");

  private MockWebServer server;
  private InMemoryLedgerSink ledger;
  private ExecutionCoordinator coordinator;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    ExecutorProperties properties = VenueTestSupport.properties(
        server.url("/").toString(), null, null, null, null, null);
    BybitApiClient client = new BybitApiClient(
        VenueTestSupport.restClient(server), MAPPER,
        VenueTestSupport.nonces(), properties);
    ledger = new InMemoryLedgerSink();
    coordinator = VenueTestSupport.coordinator(new BybitAdapter(client, properties), ledger);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void setsLeverageThenPlacesMarketOrderWithIncreasingTimestamps() throws Exception {
    server.enqueue(json("{\"retCode\":110043,\"retMsg\":\"leverage not modified\",\"result\":{}}"));
    server.enqueue(json("{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"orderId\":\"oid-1\",\"orderLinkId\":\"intent-eth\"}}"));
    TradeIntent intent = new TradeIntent("intent-eth", Venue.BYBIT, null, "ETH/USDT", OrderSide.BUY,
        new BigDecimal("0.5"), 5, null, false, null, KEY);

    ExecutionResult result = coordinator.execute(intent);

    assertThat(result.success()).isTrue();
    assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
    assertThat(result.stage()).isEqualTo(ExecutionStage.COMPLETE);
    assertThat(result.orderId()).isEqualTo("oid-1");
    assertThat(result.executedAmount()).isEqualByComparingTo("0.5");
    assertThat(result.warnings()).isEmpty();

    RecordedRequest leverage = server.takeRequest(1, TimeUnit.SECONDS);
    RecordedRequest order = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(leverage.getPath()).isEqualTo("/v5/position/set-leverage");
    JsonNode leverageBody = MAPPER.readTree(leverage.getBody().readUtf8());
    assertThat(leverageBody.path("symbol").asText()).isEqualTo("ETHUSDT");
    assertThat(leverageBody.path("buyLeverage").asText()).isEqualTo("5");

    assertThat(order.getPath()).isEqualTo("/v5/order/create");
    String orderBody = order.getBody().readUtf8();
    JsonNode orderJson = MAPPER.readTree(orderBody);
    assertThat(orderJson.path("category").asText()).isEqualTo("linear");
    assertThat(orderJson.path("side").asText()).isEqualTo("Buy");
    assertThat(orderJson.path("orderType").asText()).isEqualTo("Market");
    assertThat(orderJson.path("qty").asText()).isEqualTo("0.5");
    assertThat(orderJson.path("orderLinkId").asText()).isEqualTo("intent-eth");

    long leverageTs = Long.parseLong(leverage.getHeader(BybitAuthHeaders.TIMESTAMP));
    long orderTs = Long.parseLong(order.getHeader(BybitAuthHeaders.TIMESTAMP));
    assertThat(orderTs).isGreaterThan(leverageTs);
    assertThat(order.getHeader(BybitAuthHeaders.API_KEY)).isEqualTo("key123");
    assertThat(order.getHeader(BybitAuthHeaders.RECV_WINDOW)).isEqualTo("5000");
    assertThat(order.getHeader(BybitAuthHeaders.SIGN))
        .isEqualTo(HmacSha256.hex("secret456", orderTs + "key123" + "5000" + orderBody));

    assertThat(ledger.results()).hasSize(1);
  }

  @Test
  void freshLeverageIsSetBeforeMarketBuy() throws Exception {
    server.enqueue(json("{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{}}"));
    server.enqueue(json("{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"orderId\":\"oid-3\"}}"));
    TradeIntent intent = TradeIntent.open(Venue.BYBIT, "ETH-USDT", OrderSide.BUY, new BigDecimal("0.5"), KEY).withLeverage(5);

    ExecutionResult result = coordinator.execute(intent);

    assertThat(result.success()).isTrue();
    assertThat(result.orderId()).isEqualTo("oid-3");
    assertThat(result.warnings()).isEmpty();
    RecordedRequest leverage = server.takeRequest(1, TimeUnit.SECONDS);
    RecordedRequest order = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(leverage.getPath()).isEqualTo("/v5/position/set-leverage");
    assertThat(MAPPER.readTree(leverage.getBody().readUtf8()).path("sellLeverage").asText()).isEqualTo("5");
    assertThat(order.getPath()).isEqualTo("/v5/order/create");
    assertThat(MAPPER.readTree(order.getBody().readUtf8()).path("orderType").asText()).isEqualTo("Market");
    assertThat(Long.parseLong(order.getHeader(BybitAuthHeaders.TIMESTAMP)))
        .isGreaterThan(Long.parseLong(leverage.getHeader(BybitAuthHeaders.TIMESTAMP)));
  }

  @Test
  void explicitPriceSendsImmediateOrCancelLimitWithReduceOnly() throws Exception {
    server.enqueue(json("{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"orderId\":\"oid-4\"}}"));
    TradeIntent intent = new TradeIntent("intent-limit", Venue.BYBIT, null, "BTCUSDT", OrderSide.SELL,
        new BigDecimal("0.010"), null, new BigDecimal("65000.50"), true, null, KEY);

    ExecutionResult result = coordinator.execute(intent);

    assertThat(result.success()).isTrue();
    assertThat(result.executedPrice()).isEqualByComparingTo("65000.5");
    RecordedRequest order = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(order.getPath()).isEqualTo("/v5/order/create");
    assertThat(order.getBody().readUtf8()).isEqualTo("{\"category\":\"linear\",\"symbol\":\"BTCUSDT\",\"side\":\"Sell\","
        + "\"orderType\":\"Limit\",\"qty\":\"0.01\",\"price\":\"65000.5\",\"timeInForce\":\"IOC\","
        + "\"reduceOnly\":true,\"orderLinkId\":\"intent-limit\"}");
    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  @Test
  void leverageFailureBecomesWarningAndOrderIsStillPlaced() {
    server.enqueue(json("{\"retCode\":10001,\"retMsg\":\"leverage invalid\",\"result\":{}}"));
    server.enqueue(json("{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"orderId\":\"oid-2\"}}"));
    TradeIntent intent = TradeIntent.open(Venue.BYBIT, "BTCUSDT", OrderSide.SELL, new BigDecimal("0.01"), KEY).withLeverage(200);

    ExecutionResult result = coordinator.execute(intent);

    assertThat(result.success()).isTrue();
    assertThat(result.orderId()).isEqualTo("oid-2");
    assertThat(result.warnings()).singleElement().asString().contains("10001");
    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  void rejectedOrderCarriesVenueCodeAndResponse() {
    server.enqueue(json("{\"retCode\":110007,\"retMsg\":\"ab not enough for new order\",\"result\":{}}"));

    ExecutionResult result = coordinator.execute(
        TradeIntent.open(Venue.BYBIT, "ETHUSDT", OrderSide.BUY, BigDecimal.ONE, KEY));

    assertThat(result.success()).isFalse();
    assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(result.stage()).isEqualTo(ExecutionStage.SUBMIT);
    assertThat(result.error().kind()).isEqualTo(ErrorKind.VENUE_REJECTION);
    assertThat(result.error().code()).isEqualTo("110007");
    assertThat(result.error().retryable()).isFalse();
    assertThat(result.details().path("venueResponse").path("retMsg").asText()).contains("not enough");
  }

  @Test
  void serverErrorIsRetryableTransportFailure() {
    server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

    ExecutionResult result = coordinator.execute(
        TradeIntent.open(Venue.BYBIT, "ETHUSDT", OrderSide.BUY, BigDecimal.ONE, KEY));

    assertThat(result.error().kind()).isEqualTo(ErrorKind.TRANSPORT);
    assertThat(result.error().code()).isEqualTo("HTTP_503");
    assertThat(result.error().retryable()).isTrue();
  }

  @Test
  void walletCredentialsAreRejectedBeforeAnyRequest() {
    ExecutionResult result = coordinator.execute(
        TradeIntent.open(Venue.BYBIT, "ETHUSDT", OrderSide.BUY, BigDecimal.ONE, new WalletCredentials("abc")));

    assertThat(result.error().kind()).isEqualTo(ErrorKind.INPUT);
    assertThat(result.stage()).isEqualTo(ExecutionStage.AUTHENTICATE);
    assertThat(server.getRequestCount()).isZero();
  }

  @Test
  void signatureMatchesReferenceVector() {
    String body = "{\"category\":\"linear\",\"symbol\":\"ETHUSDT\",\"side\":\"Buy\",\"orderType\":\"Market\",\"qty\":\"0.5\",\"orderLinkId\":\"intent-1\"}";

    assertThat(BybitAuthHeaders.signature(KEY, 1_700_000_000_000L, 5_000L, body))
        .isEqualTo("6c41b6fc0456cfb20bda0b49afea6d074eb492551b3483cbdec8507cb83bfd51");
  }

  @Test
  void normalizesSymbols() {
    assertThat(BybitSymbol.normalize(" eth/usdt ").symbol()).isEqualTo("ETHUSDT");
    assertThat(BybitSymbol.normalize("BTC-USDT").symbol()).isEqualTo("BTCUSDT");
  }
}
