package com.sidexkit.engine.executor.venue.bybit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sidexkit.engine.crypto.NonceSource;
import com.sidexkit.engine.domain.ApiKeyCredentials;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.executor.config.ExecutorProperties;
import com.sidexkit.engine.executor.venue.ExecutionContext;
import com.sidexkit.engine.executor.venue.SignedOrder;
import com.sidexkit.engine.executor.venue.VenueHttp;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

@Component
public class BybitApiClient {

  static final String SET_LEVERAGE_PATH = "/v5/position/set-leverage";
  static final String CREATE_ORDER_PATH = "/v5/order/create";

  private final VenueHttp http;
  private final ObjectMapper objectMapper;
  private final NonceSource nonces;
  private final long recvWindowMillis;

  public BybitApiClient(
      @Qualifier("bybitRestClient") RestClient bybitRestClient,
      ObjectMapper objectMapper,
      NonceSource nonces,
      ExecutorProperties properties
  ) {
    this.http = new VenueHttp(Venue.BYBIT, bybitRestClient, objectMapper);
    this.objectMapper = objectMapper;
    this.nonces = nonces;
    this.recvWindowMillis = properties.bybit().recvWindowMillis();
  }

  public JsonNode setLeverage(ApiKeyCredentials key, BybitLeverageRequest request, ExecutionContext ctx) {
    String body = write(request);
    Map<String, String> headers = BybitAuthHeaders.signed(key, nonces.next(), recvWindowMillis, body);
    return http.post(SET_LEVERAGE_PATH, body, headers, ctx);
  }

  public SignedOrder<BybitOrder> sign(BybitOrder order, ApiKeyCredentials key) {
    String body = write(order);
    Map<String, String> headers = BybitAuthHeaders.signed(key, nonces.next(), recvWindowMillis, body);
    return new SignedOrder<>(order, body, headers.get(BybitAuthHeaders.SIGN), headers);
  }

  public JsonNode createOrder(SignedOrder<BybitOrder> signed, ExecutionContext ctx) {
    return http.post(CREATE_ORDER_PATH, signed.consume(), signed.headers(), ctx);
  }

  private String write(Object body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed serializing bybit request " + body.getClass().getSimpleName(), e);
    }
  }
}
