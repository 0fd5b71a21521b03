package com.sidexkit.engine.executor.venue.bybit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sidexkit.engine.domain.ApiKeyCredentials;
import com.sidexkit.engine.domain.Quote;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.domain.VenueCredentials;
import com.sidexkit.engine.error.InvalidCredentialsException;
import com.sidexkit.engine.error.InvalidIntentException;
import com.sidexkit.engine.error.VenueRejectedException;
import com.sidexkit.engine.executor.config.ExecutorProperties;
import com.sidexkit.engine.executor.venue.ExecutionContext;
import com.sidexkit.engine.executor.venue.Preparation;
import com.sidexkit.engine.executor.venue.SignedOrder;
import com.sidexkit.engine.executor.venue.Submission;
import com.sidexkit.engine.executor.venue.VenueAdapter;
import com.sidexkit.engine.settlement.Settlement;
import com.sidexkit.engine.settlement.SettlementState;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Bybit v5 linear perpetuals. Market orders, or immediate-or-cancel limit orders when the
 * intent carries a price; the order acknowledgement is the settlement signal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BybitAdapter implements VenueAdapter<ApiKeyCredentials, BybitSymbol, BybitOrder> {

  static final int LEVERAGE_NOT_MODIFIED = 110043;
  private static final int MAX_ORDER_LINK_ID = 36;

  private final @NonNull BybitApiClient client;
  private final @NonNull ExecutorProperties properties;

  @Override
  public Venue venue() {
    return Venue.BYBIT;
  }

  @Override
  public ApiKeyCredentials authenticate(VenueCredentials credentials) {
    if (!(credentials instanceof ApiKeyCredentials key)) {
      throw new InvalidCredentialsException("bybit requires an api key and secret");
    }
    if (key.apiKey() == null || key.apiKey().isBlank() || key.apiSecret() == null || key.apiSecret().isBlank()) {
      throw new InvalidCredentialsException("bybit api key and secret must not be blank");
    }
    return key;
  }

  @Override
  public BybitSymbol resolveMarket(TradeIntent intent, ExecutionContext ctx) {
    if (intent.isClose()) {
      throw new InvalidIntentException("close is not supported on bybit; submit a reduceOnly order");
    }
    return BybitSymbol.normalize(intent.symbol());
  }

  @Override
  public Preparation prepare(TradeIntent intent, ApiKeyCredentials key, BybitSymbol market, ExecutionContext ctx) {
    if (intent.hasLeverage()) {
      setLeverage(intent, key, market, ctx);
    }
    return Preparation.proceed(intent.amount().stripTrailingZeros().toPlainString(), intent.amount());
  }

  private void setLeverage(TradeIntent intent, ApiKeyCredentials key, BybitSymbol market, ExecutionContext ctx) {
    String leverage = intent.leverage().toString();
    JsonNode response = client.setLeverage(
        key,
        new BybitLeverageRequest(properties.bybit().category(), market.symbol(), leverage, leverage),
        ctx
    );
    int retCode = response.path("retCode").asInt(-1);
    if (retCode == 0) {
      log.info("bybit leverage set symbol={} leverage={}", market.symbol(), leverage);
    } else if (retCode == LEVERAGE_NOT_MODIFIED) {
      log.info("bybit leverage already set symbol={} leverage={}", market.symbol(), leverage);
    } else {
      String warning = "leverage not set: retCode=%d retMsg=%s".formatted(retCode, response.path("retMsg").asText(""));
      log.warn("bybit {} symbol={}", warning, market.symbol());
      ctx.warn(warning);
    }
  }

  @Override
  public BybitOrder buildOrder(TradeIntent intent, ApiKeyCredentials key, BybitSymbol market, Preparation preparation, Quote quote, ExecutionContext ctx) {
    boolean limit = intent.price() != null;
    return new BybitOrder(
        properties.bybit().category(),
        market.symbol(),
        intent.side().isBuy() ? "Buy" : "Sell",
        limit ? "Limit" : "Market",
        preparation.quantity(),
        limit ? intent.price().stripTrailingZeros().toPlainString() : null,
        limit ? "IOC" : null,
        intent.reduceOnly() ? Boolean.TRUE : null,
        orderLinkId(intent.id())
    );
  }

  @Override
  public SignedOrder<BybitOrder> sign(BybitOrder order, ApiKeyCredentials key, ExecutionContext ctx) {
    return client.sign(order, key);
  }

  @Override
  public Submission submit(SignedOrder<BybitOrder> order, ExecutionContext ctx) {
    JsonNode response = client.createOrder(order, ctx);
    int retCode = response.path("retCode").asInt(-1);
    if (retCode != 0) {
      String retMsg = response.path("retMsg").asText("");
      throw new VenueRejectedException(Venue.BYBIT, Integer.toString(retCode),
          "bybit rejected order: retCode=%d retMsg=%s".formatted(retCode, retMsg), response);
    }
    JsonNode result = response.path("result");
    String orderId = result.path("orderId").asText(null);
    ObjectNode details = ctx.objectMapper().createObjectNode()
        .put("orderId", orderId)
        .put("orderLinkId", result.path("orderLinkId").asText(order.order().orderLinkId()));
    BybitOrder sent = order.order();
    log.info("bybit order submitted symbol={} side={} qty={} orderId={}", sent.symbol(), sent.side(), sent.qty(), orderId);
    return new Submission(
        orderId,
        null,
        response,
        new BigDecimal(sent.qty()),
        sent.price() == null ? null : new BigDecimal(sent.price()),
        details
    );
  }

  @Override
  public Settlement confirm(TradeIntent intent, Submission submission, ExecutionContext ctx) {
    return Settlement.builder()
        .state(SettlementState.CONFIRMED)
        .orderId(submission.orderId())
        .executedAmount(submission.expectedAmount())
        .executedPrice(submission.expectedPrice())
        .details(submission.details())
        .build();
  }

  static String orderLinkId(String intentId) {
    return intentId.length() <= MAX_ORDER_LINK_ID ? intentId : intentId.substring(0, MAX_ORDER_LINK_ID);
  }
}
