package com.sidexkit.engine.error;

import com.sidexkit.engine.domain.ErrorKind;

import java.net.URI;

/**
 * The request did not produce a usable venue response: connection failure, timeout,
 * HTTP error status or an unreadable body.
 */
public class VenueTransportException extends ExecutionException {

  private final String method;
  private final URI uri;
  private final Integer statusCode;

  public VenueTransportException(String method, URI uri, Integer statusCode, String message, Throwable cause) {
    super(message, cause);
    this.method = method;
    this.uri = uri;
    this.statusCode = statusCode;
  }

  public String method() {
    return method;
  }

  public URI uri() {
    return uri;
  }

  public Integer statusCode() {
    return statusCode;
  }

  @Override
  public String code() {
    return statusCode == null ? null : "HTTP_" + statusCode;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.TRANSPORT;
  }
}
