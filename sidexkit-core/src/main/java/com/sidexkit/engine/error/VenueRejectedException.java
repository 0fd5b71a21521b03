package com.sidexkit.engine.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.sidexkit.engine.domain.ErrorKind;
import com.sidexkit.engine.domain.Venue;

/**
 * The venue received the request and refused it.
 */
public class VenueRejectedException extends ExecutionException {

  private final Venue venue;
  private final String code;
  private final transient JsonNode response;

  public VenueRejectedException(Venue venue, String code, String message, JsonNode response) {
    super(message);
    this.venue = venue;
    this.code = code;
    this.response = response;
  }

  public Venue venue() {
    return venue;
  }

  @Override
  public String code() {
    return code;
  }

  public JsonNode response() {
    return response;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.VENUE_REJECTION;
  }
}
