package com.sidexkit.engine.domain;

import com.sidexkit.engine.error.InvalidIntentException;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Venue-agnostic trade request. Immutable once handed to a venue adapter.
 *
 * @param id          caller id, generated when absent; used as the venue correlation id where supported
 * @param venue       target venue
 * @param action      open a trade or close the held position
 * @param symbol      human symbol ({@code BTC/USDT}, {@code ETH}) or a mint address on Solana
 * @param side        trade direction; ignored for {@link TradeAction#CLOSE}
 * @param amount      order size in the venue's native unit; ignored for {@link TradeAction#CLOSE}
 * @param leverage    leverage to apply before ordering on derivatives venues, {@code null} to keep the current one
 * @param price       explicit limit price, {@code null} to derive a marketable price
 * @param reduceOnly  reduce-only flag for derivatives venues
 * @param constraints execution constraints, never {@code null}
 * @param credentials venue credentials, {@code null} to use configured ones
 */
public record TradeIntent(
    String id,
    Venue venue,
    TradeAction action,
    String symbol,
    OrderSide side,
    BigDecimal amount,
    Integer leverage,
    BigDecimal price,
    boolean reduceOnly,
    TradeConstraints constraints,
    VenueCredentials credentials
) {

  public TradeIntent {
    if (id == null || id.isBlank()) {
      id = UUID.randomUUID().toString();
    }
    if (action == null) {
      action = TradeAction.OPEN;
    }
    if (constraints == null) {
      constraints = TradeConstraints.none();
    }
  }

  public static TradeIntent open(Venue venue, String symbol, OrderSide side, BigDecimal amount, VenueCredentials credentials) {
    return new TradeIntent(null, venue, TradeAction.OPEN, symbol, side, amount, null, null, false, null, credentials);
  }

  public static TradeIntent close(Venue venue, String symbol, VenueCredentials credentials) {
    return new TradeIntent(null, venue, TradeAction.CLOSE, symbol, OrderSide.SELL, null, null, null, false, null, credentials);
  }

  public TradeIntent withLeverage(Integer newLeverage) {
    return new TradeIntent(id, venue, action, symbol, side, amount, newLeverage, price, reduceOnly, constraints, credentials);
  }

  public TradeIntent withPrice(BigDecimal newPrice) {
    return new TradeIntent(id, venue, action, symbol, side, amount, leverage, newPrice, reduceOnly, constraints, credentials);
  }

  public TradeIntent withConstraints(TradeConstraints newConstraints) {
    return new TradeIntent(id, venue, action, symbol, side, amount, leverage, price, reduceOnly, newConstraints, credentials);
  }

  public boolean isClose() {
    return action == TradeAction.CLOSE;
  }

  public boolean hasLeverage() {
    return leverage != null && leverage > 1;
  }

  /**
   * Presence and range checks that need no venue knowledge.
   */
  public void validate() {
    if (venue == null) {
      throw new InvalidIntentException("venue is required");
    }
    if (symbol == null || symbol.isBlank()) {
      throw new InvalidIntentException("symbol is required");
    }
    if (isClose()) {
      return;
    }
    if (side == null) {
      throw new InvalidIntentException("side is required");
    }
    if (amount == null || amount.signum() <= 0) {
      throw new InvalidIntentException("amount must be positive");
    }
    if (leverage != null && leverage < 1) {
      throw new InvalidIntentException("leverage must be >= 1");
    }
    if (price != null && price.signum() <= 0) {
      throw new InvalidIntentException("price must be positive");
    }
    Integer slippage = constraints.maxSlippageBps();
    if (slippage != null && (slippage < 0 || slippage > 10_000)) {
      throw new InvalidIntentException("maxSlippageBps must be within [0, 10000]");
    }
  }
}
