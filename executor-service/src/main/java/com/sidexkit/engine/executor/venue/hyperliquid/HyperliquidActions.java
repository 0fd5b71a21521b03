package com.sidexkit.engine.executor.venue.hyperliquid;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Exchange action payloads. Field order is part of the signed hash, so every record pins it.
 */
public final class HyperliquidActions {

  private HyperliquidActions() {
  }

  @JsonPropertyOrder({"type", "orders", "grouping"})
  public record OrderAction(
      @JsonProperty("type") String type,
      @JsonProperty("orders") List<OrderWire> orders,
      @JsonProperty("grouping") String grouping
  ) {
    public static OrderAction single(OrderWire order) {
      return new OrderAction("order", List.of(order), "na");
    }
  }

  /**
   * @param a asset index
   * @param b is buy
   * @param p limit price
   * @param s size
   * @param r reduce only
   * @param t order type
   */
  @JsonPropertyOrder({"a", "b", "p", "s", "r", "t"})
  public record OrderWire(
      @JsonProperty("a") int a,
      @JsonProperty("b") boolean b,
      @JsonProperty("p") String p,
      @JsonProperty("s") String s,
      @JsonProperty("r") boolean r,
      @JsonProperty("t") OrderTypeWire t
  ) {
  }

  public record OrderTypeWire(@JsonProperty("limit") LimitWire limit) {

    public static OrderTypeWire ioc() {
      return new OrderTypeWire(new LimitWire("Ioc"));
    }
  }

  public record LimitWire(@JsonProperty("tif") String tif) {
  }

  @JsonPropertyOrder({"type", "asset", "isCross", "leverage"})
  public record UpdateLeverageAction(
      @JsonProperty("type") String type,
      @JsonProperty("asset") int asset,
      @JsonProperty("isCross") boolean isCross,
      @JsonProperty("leverage") int leverage
  ) {
    public static UpdateLeverageAction of(int asset, boolean isCross, int leverage) {
      return new UpdateLeverageAction("updateLeverage", asset, isCross, leverage);
    }
  }

  public record Signature(
      @JsonProperty("r") String r,
      @JsonProperty("s") String s,
      @JsonProperty("v") int v
  ) {
  }

  @JsonInclude(JsonInclude.Include.ALWAYS)
  @JsonPropertyOrder({"action", "nonce", "signature", "vaultAddress"})
  public record ExchangeRequest(
      @JsonProperty("action") Object action,
      @JsonProperty("nonce") long nonce,
      @JsonProperty("signature") Signature signature,
      @JsonProperty("vaultAddress") String vaultAddress
  ) {
  }
}
