package com.sidexkit.engine.executor.venue.bybit;

import com.sidexkit.engine.crypto.HmacSha256;
import com.sidexkit.engine.domain.ApiKeyCredentials;

import java.util.Map;
import java.util.Objects;

/**
 * Bybit v5 request authentication: {@code hex(HMAC_SHA256(secret, timestamp + apiKey + recvWindow + payload))},
 * where the payload is the JSON body for POST and the query string for GET.
 */
public final class BybitAuthHeaders {

  public static final String API_KEY = "X-BAPI-API-KEY";
  public static final String TIMESTAMP = "X-BAPI-TIMESTAMP";
  public static final String SIGN = "X-BAPI-SIGN";
  public static final String RECV_WINDOW = "X-BAPI-RECV-WINDOW";

  private BybitAuthHeaders() {
  }

  public static String signature(ApiKeyCredentials key, long timestampMillis, long recvWindowMillis, String payload) {
    Objects.requireNonNull(key, "key");
    String prehash = timestampMillis + key.apiKey() + recvWindowMillis + (payload == null ? "" : payload);
    return HmacSha256.hex(key.apiSecret(), prehash);
  }

  public static Map<String, String> signed(ApiKeyCredentials key, long timestampMillis, long recvWindowMillis, String payload) {
    return Map.of(
        API_KEY, key.apiKey(),
        TIMESTAMP, Long.toString(timestampMillis),
        SIGN, signature(key, timestampMillis, recvWindowMillis, payload),
        RECV_WINDOW, Long.toString(recvWindowMillis)
    );
  }
}
