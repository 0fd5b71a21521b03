package com.sidexkit.engine.domain;

public record ApiKeyCredentials(String apiKey, String apiSecret) implements VenueCredentials {

  @Override
  public String toString() {
    return "ApiKeyCredentials[apiKey=" + VenueCredentials.mask(apiKey) + ", apiSecret=****]";
  }
}
