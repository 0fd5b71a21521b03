package com.sidexkit.engine.executor.venue.jupiter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.error.MarketNotFoundException;
import com.sidexkit.engine.error.VenueRejectedException;
import com.sidexkit.engine.executor.config.ExecutorProperties;
import com.sidexkit.engine.executor.venue.ExecutionContext;
import com.sidexkit.engine.executor.venue.VenueHttp;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The handful of Solana JSON-RPC calls a swap needs. JSON-RPC errors surface as venue
 * rejections; HTTP and connection failures as transport errors.
 */
@Component
public class SolanaRpcClient {

  private final VenueHttp http;
  private final ObjectMapper objectMapper;
  private final ExecutorProperties.Jupiter config;
  private final AtomicLong ids = new AtomicLong();

  public SolanaRpcClient(
      @Qualifier("solanaRpcRestClient") RestClient solanaRpcRestClient,
      ObjectMapper objectMapper,
      ExecutorProperties properties
  ) {
    this.http = new VenueHttp(Venue.SOLANA_JUPITER, solanaRpcRestClient, objectMapper);
    this.objectMapper = objectMapper;
    this.config = properties.jupiter();
  }

  /**
   * @param amount raw base units summed over all of the owner's token accounts for the mint
   */
  public record TokenBalance(BigInteger amount, int decimals) {
  }

  /**
   * @param err on-chain error, {@code null} when the transaction succeeded or is still in flight
   */
  public record SignatureStatus(String confirmationStatus, JsonNode err, Long slot) {

    public boolean failed() {
      return err != null && !err.isNull();
    }
  }

  public TokenBalance tokenBalance(String owner, String mint, int decimals, ExecutionContext ctx) {
    ArrayNode params = objectMapper.createArrayNode().add(owner);
    params.addObject().put("mint", mint);
    params.addObject().put("encoding", "jsonParsed").put("commitment", config.commitment());
    JsonNode accounts = call("getTokenAccountsByOwner", params, ctx).path("value");
    BigInteger total = BigInteger.ZERO;
    int resolvedDecimals = decimals;
    for (JsonNode account : accounts) {
      JsonNode tokenAmount = account.path("account").path("data").path("parsed").path("info").path("tokenAmount");
      total = total.add(new BigInteger(tokenAmount.path("amount").asText("0")));
      resolvedDecimals = tokenAmount.path("decimals").asInt(resolvedDecimals);
    }
    return new TokenBalance(total, resolvedDecimals);
  }

  public BigInteger lamports(String owner, ExecutionContext ctx) {
    ArrayNode params = objectMapper.createArrayNode().add(owner);
    params.addObject().put("commitment", config.commitment());
    return call("getBalance", params, ctx).path("value").bigIntegerValue();
  }

  public int mintDecimals(String mint, ExecutionContext ctx) {
    ArrayNode params = objectMapper.createArrayNode().add(mint);
    params.addObject().put("encoding", "jsonParsed");
    JsonNode info = call("getAccountInfo", params, ctx).path("value").path("data").path("parsed").path("info");
    if (!info.has("decimals")) {
      throw new MarketNotFoundException(mint, "token mint not found: " + mint);
    }
    return info.path("decimals").asInt();
  }

  public String sendTransaction(String base64Transaction, ExecutionContext ctx) {
    ArrayNode params = objectMapper.createArrayNode().add(base64Transaction);
    params.addObject()
        .put("encoding", "base64")
        .put("skipPreflight", config.skipPreflight())
        .put("preflightCommitment", config.commitment())
        .put("maxRetries", config.rpcMaxRetries());
    return call("sendTransaction", params, ctx).asText();
  }

  public SignatureStatus signatureStatus(String signature, ExecutionContext ctx) {
    ArrayNode params = objectMapper.createArrayNode();
    params.addArray().add(signature);
    params.addObject().put("searchTransactionHistory", true);
    JsonNode status = call("getSignatureStatuses", params, ctx).path("value").path(0);
    if (status.isMissingNode() || status.isNull()) {
      return null;
    }
    return new SignatureStatus(
        status.path("confirmationStatus").asText(null),
        status.get("err"),
        status.hasNonNull("slot") ? status.get("slot").asLong() : null
    );
  }

  private JsonNode call(String method, ArrayNode params, ExecutionContext ctx) {
    ObjectNode request = objectMapper.createObjectNode()
        .put("jsonrpc", "2.0")
        .put("id", ids.incrementAndGet())
        .put("method", method);
    request.set("params", params);
    JsonNode response = http.post("", write(request), Map.of(), ctx);
    JsonNode error = response.path("error");
    if (!error.isMissingNode() && !error.isNull()) {
      throw new VenueRejectedException(Venue.SOLANA_JUPITER, error.path("code").asText("rpc_error"),
          "%s failed: %s".formatted(method, error.path("message").asText(error.toString())), response);
    }
    return response.path("result");
  }

  private String write(JsonNode request) {
    try {
      return objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed serializing rpc request", e);
    }
  }
}
