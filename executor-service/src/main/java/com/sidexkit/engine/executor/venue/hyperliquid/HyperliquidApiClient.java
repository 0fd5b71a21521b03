package com.sidexkit.engine.executor.venue.hyperliquid;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.error.VenueTransportException;
import com.sidexkit.engine.executor.venue.ExecutionContext;
import com.sidexkit.engine.executor.venue.VenueHttp;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class HyperliquidApiClient {

  static final String INFO_PATH = "/info";
  static final String EXCHANGE_PATH = "/exchange";

  private static final Pattern DECIMAL = Pattern.compile("\\d+(\\.\\d+)?");

  private final VenueHttp http;
  private final ObjectMapper objectMapper;

  public HyperliquidApiClient(@Qualifier("hyperliquidRestClient") RestClient hyperliquidRestClient, ObjectMapper objectMapper) {
    this.http = new VenueHttp(Venue.HYPERLIQUID, hyperliquidRestClient, objectMapper);
    this.objectMapper = objectMapper;
  }

  public List<HyperliquidAsset> universe(ExecutionContext ctx) {
    JsonNode universe = info("meta", ctx).path("universe");
    if (!universe.isArray()) {
      throw new VenueTransportException("POST", URI.create(INFO_PATH), null, "meta response has no universe", null);
    }
    List<HyperliquidAsset> assets = new ArrayList<>(universe.size());
    for (int i = 0; i < universe.size(); i++) {
      JsonNode asset = universe.get(i);
      assets.add(new HyperliquidAsset(i, asset.path("name").asText(), asset.path("szDecimals").asInt(0)));
    }
    return assets;
  }

  /**
   * Mid prices keyed by coin name.
   */
  public Map<String, BigDecimal> allMids(ExecutionContext ctx) {
    JsonNode mids = info("allMids", ctx);
    Map<String, BigDecimal> out = new HashMap<>();
    mids.fields().forEachRemaining(e -> {
      String px = e.getValue().asText();
      if (DECIMAL.matcher(px).matches()) {
        out.put(e.getKey(), new BigDecimal(px));
      }
    });
    return out;
  }

  public JsonNode exchange(String signedRequestJson, ExecutionContext ctx) {
    return http.post(EXCHANGE_PATH, signedRequestJson, Map.of(), ctx);
  }

  String write(Object request) {
    try {
      return objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed serializing hyperliquid request", e);
    }
  }

  private JsonNode info(String type, ExecutionContext ctx) {
    return http.post(INFO_PATH, write(Map.of("type", type)), Map.of(), ctx);
  }
}
