package com.sidexkit.engine.error;

import com.sidexkit.engine.domain.ErrorKind;

public class MarketNotFoundException extends ExecutionException {

  private final String symbol;

  public MarketNotFoundException(String symbol, String message) {
    super(message);
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  @Override
  public ErrorKind kind() {
    return ErrorKind.RESOLUTION;
  }
}
