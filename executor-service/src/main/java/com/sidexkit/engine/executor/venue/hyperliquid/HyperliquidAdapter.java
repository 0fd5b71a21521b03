package com.sidexkit.engine.executor.venue.hyperliquid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sidexkit.engine.crypto.NonceSource;
import com.sidexkit.engine.domain.Quote;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.domain.VenueCredentials;
import com.sidexkit.engine.domain.WalletCredentials;
import com.sidexkit.engine.error.InvalidCredentialsException;
import com.sidexkit.engine.error.InvalidIntentException;
import com.sidexkit.engine.error.MarketNotFoundException;
import com.sidexkit.engine.error.VenueRejectedException;
import com.sidexkit.engine.executor.config.ExecutorProperties;
import com.sidexkit.engine.executor.venue.ExecutionContext;
import com.sidexkit.engine.executor.venue.Preparation;
import com.sidexkit.engine.executor.venue.SignedOrder;
import com.sidexkit.engine.executor.venue.Submission;
import com.sidexkit.engine.executor.venue.VenueAdapter;
import com.sidexkit.engine.executor.venue.hyperliquid.HyperliquidActions.ExchangeRequest;
import com.sidexkit.engine.executor.venue.hyperliquid.HyperliquidActions.OrderAction;
import com.sidexkit.engine.executor.venue.hyperliquid.HyperliquidActions.OrderTypeWire;
import com.sidexkit.engine.executor.venue.hyperliquid.HyperliquidActions.OrderWire;
import com.sidexkit.engine.executor.venue.hyperliquid.HyperliquidActions.Signature;
import com.sidexkit.engine.executor.venue.hyperliquid.HyperliquidActions.UpdateLeverageAction;
import com.sidexkit.engine.settlement.Settlement;
import com.sidexkit.engine.settlement.SettlementState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Hyperliquid perpetuals. Orders are IOC limit orders priced through the mid when the intent
 * has no price, signed as L1 actions.
 */
@Component
@Slf4j
public class HyperliquidAdapter implements VenueAdapter<Credentials, HyperliquidAsset, OrderAction> {

  private static final Pattern PRIVATE_KEY = Pattern.compile("[0-9a-fA-F]{64}");

  private final HyperliquidApiClient client;
  private final HyperliquidActionSigner signer;
  private final NonceSource nonces;
  private final ExecutorProperties.Hyperliquid config;

  public HyperliquidAdapter(HyperliquidApiClient client, NonceSource nonces, ExecutorProperties properties) {
    this.client = client;
    this.signer = new HyperliquidActionSigner();
    this.nonces = nonces;
    this.config = properties.hyperliquid();
  }

  @Override
  public Venue venue() {
    return Venue.HYPERLIQUID;
  }

  @Override
  public Credentials authenticate(VenueCredentials credentials) {
    if (!(credentials instanceof WalletCredentials wallet) || wallet.privateKey() == null) {
      throw new InvalidCredentialsException("hyperliquid requires a wallet private key");
    }
    String hex = Numeric.cleanHexPrefix(wallet.privateKey().trim());
    if (!PRIVATE_KEY.matcher(hex).matches()) {
      throw new InvalidCredentialsException("invalid key format: expected 32-byte hex private key");
    }
    if (wallet.walletAddress() != null && !WalletUtils.isValidAddress(wallet.walletAddress())) {
      throw new InvalidCredentialsException("invalid wallet address");
    }
    return Credentials.create(hex);
  }

  @Override
  public HyperliquidAsset resolveMarket(TradeIntent intent, ExecutionContext ctx) {
    if (intent.isClose()) {
      throw new InvalidIntentException("close is not supported on hyperliquid; submit a reduceOnly order");
    }
    HyperliquidAsset asset = HyperliquidSymbols.resolve(intent.symbol(), client.universe(ctx));
    log.info("hyperliquid asset resolved symbol={} asset={} index={} szDecimals={}",
        intent.symbol(), asset.name(), asset.index(), asset.szDecimals());
    return asset;
  }

  @Override
  public Preparation prepare(TradeIntent intent, Credentials key, HyperliquidAsset market, ExecutionContext ctx) {
    if (intent.hasLeverage()) {
      updateLeverage(intent.leverage(), key, market, ctx);
    }
    String size = HyperliquidPrices.formatSize(intent.amount(), market.szDecimals());
    if ("0".equals(size)) {
      throw new InvalidIntentException("amount %s rounds to zero at %d size decimals".formatted(
          intent.amount().toPlainString(), market.szDecimals()));
    }
    return Preparation.proceed(size, new BigDecimal(size));
  }

  private void updateLeverage(int leverage, Credentials key, HyperliquidAsset market, ExecutionContext ctx) {
    UpdateLeverageAction action = UpdateLeverageAction.of(market.index(), config.crossMargin(), leverage);
    long nonce = nonces.next();
    Signature signature = signer.sign(key, action, nonce, config.vaultAddress(), config.mainnet());
    JsonNode response = client.exchange(client.write(new ExchangeRequest(action, nonce, signature, config.vaultAddress())), ctx);
    if ("ok".equals(response.path("status").asText())) {
      log.info("hyperliquid leverage set asset={} leverage={}", market.name(), leverage);
    } else {
      String warning = "leverage not set: " + response.path("response").asText(response.toString());
      log.warn("hyperliquid {} asset={}", warning, market.name());
      ctx.warn(warning);
    }
  }

  @Override
  public OrderAction buildOrder(TradeIntent intent, Credentials key, HyperliquidAsset market, Preparation preparation, Quote quote, ExecutionContext ctx) {
    BigDecimal price = intent.price();
    if (price == null) {
      BigDecimal mid = client.allMids(ctx).get(market.name());
      if (mid == null) {
        throw new MarketNotFoundException(intent.symbol(), "no mid price for " + market.name());
      }
      price = HyperliquidPrices.marketable(mid, intent.side().isBuy(), config.marketSlippage());
    }
    OrderWire order = new OrderWire(
        market.index(),
        intent.side().isBuy(),
        HyperliquidPrices.formatPrice(price, market.szDecimals()),
        preparation.quantity(),
        intent.reduceOnly(),
        OrderTypeWire.ioc()
    );
    return OrderAction.single(order);
  }

  @Override
  public SignedOrder<OrderAction> sign(OrderAction order, Credentials key, ExecutionContext ctx) {
    long nonce = nonces.next();
    Signature signature = signer.sign(key, order, nonce, config.vaultAddress(), config.mainnet());
    String payload = client.write(new ExchangeRequest(order, nonce, signature, config.vaultAddress()));
    return new SignedOrder<>(order, payload, signature.r() + signature.s().substring(2));
  }

  @Override
  public Submission submit(SignedOrder<OrderAction> order, ExecutionContext ctx) {
    JsonNode response = client.exchange(order.consume(), ctx);
    if (!"ok".equals(response.path("status").asText())) {
      throw new VenueRejectedException(Venue.HYPERLIQUID, "err",
          "hyperliquid rejected order: " + response.path("response").asText(response.toString()), response);
    }
    JsonNode statuses = response.path("response").path("data").path("statuses");
    List<String> errors = new ArrayList<>();
    String orderId = null;
    JsonNode filled = null;
    for (JsonNode status : statuses) {
      if (status.has("error")) {
        errors.add(status.path("error").asText());
      }
      if (status.has("filled")) {
        filled = status.path("filled");
        orderId = filled.path("oid").asText(orderId);
      } else if (status.has("resting")) {
        orderId = status.path("resting").path("oid").asText(orderId);
      }
    }
    if (!errors.isEmpty() && orderId == null) {
      throw new VenueRejectedException(Venue.HYPERLIQUID, "order_error",
          "hyperliquid order error: " + String.join("; ", errors), response);
    }
    errors.forEach(e -> ctx.warn("order status error: " + e));

    OrderWire sent = order.order().orders().get(0);
    ObjectNode details = ctx.objectMapper().createObjectNode()
        .put("asset", sent.a())
        .put("limitPx", sent.p());
    details.set("statuses", statuses);
    BigDecimal amount = filled != null ? decimal(filled.path("totalSz"), sent.s()) : new BigDecimal(sent.s());
    BigDecimal price = filled != null ? decimal(filled.path("avgPx"), sent.p()) : new BigDecimal(sent.p());
    log.info("hyperliquid order submitted asset={} side={} size={} px={} oid={} filled={}",
        sent.a(), sent.b() ? "buy" : "sell", sent.s(), sent.p(), orderId, filled != null);
    return new Submission(orderId, null, response, amount, price, details);
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

  private static BigDecimal decimal(JsonNode node, String fallback) {
    String text = node.asText(null);
    return new BigDecimal(text == null || text.isBlank() ? fallback : text);
  }
}
