package com.sidexkit.engine.executor.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.error.VenueRejectedException;
import com.sidexkit.engine.error.VenueTransportException;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.util.Map;

/**
 * JSON request helper shared by the venue clients. Every request and response is traced to
 * the ledger, and HTTP failures are mapped onto the execution error taxonomy: a 4xx other
 * than 408 or 429 is the venue refusing the request, anything else is transport.
 */
public final class VenueHttp {

  private static final int ERROR_MAX_LEN = 512;

  private final Venue venue;
  private final RestClient restClient;
  private final ObjectMapper objectMapper;

  public VenueHttp(Venue venue, RestClient restClient, ObjectMapper objectMapper) {
    this.venue = venue;
    this.restClient = restClient;
    this.objectMapper = objectMapper;
  }

  public JsonNode get(String path, Map<String, ?> query, ExecutionContext ctx) {
    Map<String, ?> params = query == null ? Map.of() : query;
    ObjectNode request = objectMapper.createObjectNode().put("method", "GET").put("path", path);
    request.set("query", objectMapper.valueToTree(params));
    ctx.trace("request", request);
    try {
      String body = restClient.get()
          .uri(uriBuilder -> {
            uriBuilder.path(path);
            params.forEach((k, v) -> {
              if (v != null) {
                uriBuilder.queryParam(k, v);
              }
            });
            return uriBuilder.build();
          })
          .accept(MediaType.APPLICATION_JSON)
          .retrieve()
          .body(String.class);
      return handleBody("GET", path, body, ctx);
    } catch (RestClientException e) {
      throw translate("GET", path, e, ctx);
    }
  }

  public JsonNode post(String path, String jsonBody, Map<String, String> headers, ExecutionContext ctx) {
    ObjectNode request = objectMapper.createObjectNode().put("method", "POST").put("path", path);
    request.set("body", readOrText(jsonBody));
    ctx.trace("request", request);
    try {
      String body = restClient.post()
          .uri(path)
          .contentType(MediaType.APPLICATION_JSON)
          .accept(MediaType.APPLICATION_JSON)
          .headers(h -> {
            if (headers != null) {
              headers.forEach(h::set);
            }
          })
          .body(jsonBody)
          .retrieve()
          .body(String.class);
      return handleBody("POST", path, body, ctx);
    } catch (RestClientException e) {
      throw translate("POST", path, e, ctx);
    }
  }

  private JsonNode handleBody(String method, String path, String body, ExecutionContext ctx) {
    if (body == null || body.isBlank()) {
      JsonNode empty = objectMapper.nullNode();
      ctx.recordResponse(empty);
      ctx.trace("response", empty);
      return empty;
    }
    JsonNode json;
    try {
      json = objectMapper.readTree(body);
    } catch (Exception e) {
      ctx.trace("response", objectMapper.getNodeFactory().textNode(truncate(body)));
      throw new VenueTransportException(method, URI.create(path), null,
          "%s %s returned an unreadable body".formatted(method, path), e);
    }
    ctx.recordResponse(json);
    ctx.trace("response", json);
    return json;
  }

  private RuntimeException translate(String method, String path, RestClientException e, ExecutionContext ctx) {
    URI uri = URI.create(path);
    if (e instanceof RestClientResponseException re) {
      int status = re.getStatusCode().value();
      String responseBody = re.getResponseBodyAsString();
      JsonNode json = readOrText(responseBody);
      ctx.recordResponse(json);
      ObjectNode payload = objectMapper.createObjectNode().put("status", status);
      payload.set("body", json);
      ctx.trace("response", payload);
      String message = "%s %s failed status=%d body=%s".formatted(method, path, status, truncate(responseBody));
      if (status >= 400 && status < 500 && status != 408 && status != 429) {
        return new VenueRejectedException(venue, "HTTP_" + status, message, json);
      }
      return new VenueTransportException(method, uri, status, message, e);
    }
    ctx.trace("transport_error", objectMapper.createObjectNode().put("error", e.toString()));
    if (e instanceof ResourceAccessException) {
      return new VenueTransportException(method, uri, null, "%s %s unreachable: %s".formatted(method, path, e.getMessage()), e);
    }
    return new VenueTransportException(method, uri, null, "%s %s failed: %s".formatted(method, path, e.getMessage()), e);
  }

  private JsonNode readOrText(String raw) {
    if (raw == null || raw.isBlank()) {
      return objectMapper.nullNode();
    }
    try {
      return objectMapper.readTree(raw);
    } catch (Exception e) {
      return objectMapper.getNodeFactory().textNode(truncate(raw));
    }
  }

  private static String truncate(String s) {
    if (s == null) {
      return null;
    }
    return s.length() <= ERROR_MAX_LEN ? s : s.substring(0, ERROR_MAX_LEN) + "...";
  }
}
