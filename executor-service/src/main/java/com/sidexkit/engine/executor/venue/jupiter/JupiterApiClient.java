package com.sidexkit.engine.executor.venue.jupiter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sidexkit.engine.domain.Quote;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.error.VenueRejectedException;
import com.sidexkit.engine.executor.venue.ExecutionContext;
import com.sidexkit.engine.executor.venue.VenueHttp;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class JupiterApiClient {

  private final VenueHttp http;
  private final ObjectMapper objectMapper;

  public JupiterApiClient(@Qualifier("jupiterRestClient") RestClient jupiterRestClient, ObjectMapper objectMapper) {
    this.http = new VenueHttp(Venue.SOLANA_JUPITER, jupiterRestClient, objectMapper);
    this.objectMapper = objectMapper;
  }

  public Quote quote(String inputMint, String outputMint, BigInteger amount, int slippageBps, ExecutionContext ctx) {
    Map<String, Object> query = new LinkedHashMap<>();
    query.put("inputMint", inputMint);
    query.put("outputMint", outputMint);
    query.put("amount", amount.toString());
    query.put("slippageBps", slippageBps);
    JsonNode quote = http.get("/quote", query, ctx);
    if (quote.hasNonNull("error")) {
      throw new VenueRejectedException(Venue.SOLANA_JUPITER, quote.path("errorCode").asText("QUOTE_ERROR"),
          "jupiter quote failed: " + quote.path("error").asText(), quote);
    }
    if (!quote.hasNonNull("outAmount")) {
      throw new VenueRejectedException(Venue.SOLANA_JUPITER, "QUOTE_ERROR", "jupiter quote has no outAmount", quote);
    }
    List<String> labels = new ArrayList<>();
    for (JsonNode step : quote.path("routePlan")) {
      String label = step.path("swapInfo").path("label").asText(null);
      if (label != null) {
        labels.add(label);
      }
    }
    return new Quote(
        new BigInteger(quote.path("inAmount").asText(amount.toString())),
        new BigInteger(quote.path("outAmount").asText()),
        new BigDecimal(quote.path("priceImpactPct").asText("0")),
        String.join(" -> ", labels),
        quote
    );
  }

  /**
   * @return the unsigned swap transaction, base64
   */
  public String swapTransaction(Quote quote, String userPublicKey, ExecutionContext ctx) {
    ObjectNode body = objectMapper.createObjectNode();
    body.set("quoteResponse", quote.raw());
    body.put("userPublicKey", userPublicKey)
        .put("wrapAndUnwrapSol", true)
        .put("dynamicComputeUnitLimit", true)
        .put("prioritizationFeeLamports", "auto");
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed serializing swap request", e);
    }
    JsonNode response = http.post("/swap", json, Map.of(), ctx);
    String tx = response.path("swapTransaction").asText(null);
    if (tx == null || tx.isBlank()) {
      throw new VenueRejectedException(Venue.SOLANA_JUPITER, "SWAP_ERROR",
          "jupiter swap returned no transaction: " + response.path("error").asText(""), response);
    }
    return tx;
  }
}
