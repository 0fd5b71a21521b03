package com.sidexkit.engine.executor.venue;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A signed, ready-to-send request. Its payload can be taken exactly once; retrying an
 * execution means building and signing a new order.
 */
public final class SignedOrder<O> {

  private final O order;
  private final String payload;
  private final String signature;
  private final Map<String, String> headers;
  private final AtomicBoolean consumed = new AtomicBoolean();

  public SignedOrder(O order, String payload, String signature, Map<String, String> headers) {
    this.order = order;
    this.payload = payload;
    this.signature = signature;
    this.headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public SignedOrder(O order, String payload, String signature) {
    this(order, payload, signature, Map.of());
  }

  public O order() {
    return order;
  }

  public String signature() {
    return signature;
  }

  public Map<String, String> headers() {
    return headers;
  }

  public String consume() {
    if (!consumed.compareAndSet(false, true)) {
      throw new IllegalStateException("signed order already submitted");
    }
    return payload;
  }
}
