package com.sidexkit.engine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionStage {
  VALIDATE,
  AUTHENTICATE,
  RESOLVE_MARKET,
  PREPARE,
  QUOTE,
  BUILD_ORDER,
  SIGN,
  SUBMIT,
  CONFIRM,
  COMPLETE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Whether a request may have reached the venue once this stage has been entered.
   */
  public boolean isPostSubmit() {
    return ordinal() >= SUBMIT.ordinal();
  }
}
