package com.sidexkit.engine.settlement;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one submission: {@code BUILT -> SIGNED -> BROADCAST -> PENDING -> CONFIRMED | FAILED | TIMED_OUT}.
 * Venues that acknowledge synchronously go straight from BROADCAST to a terminal state.
 */
public enum SettlementState {
  BUILT,
  SIGNED,
  BROADCAST,
  PENDING,
  CONFIRMED,
  FAILED,
  TIMED_OUT;

  public boolean isTerminal() {
    return this == CONFIRMED || this == FAILED || this == TIMED_OUT;
  }

  public boolean canTransitionTo(SettlementState next) {
    return successors().contains(next);
  }

  private Set<SettlementState> successors() {
    return switch (this) {
      case BUILT -> EnumSet.of(SIGNED);
      case SIGNED -> EnumSet.of(BROADCAST);
      case BROADCAST -> EnumSet.of(PENDING, CONFIRMED, FAILED);
      case PENDING -> EnumSet.of(CONFIRMED, FAILED, TIMED_OUT);
      case CONFIRMED, FAILED, TIMED_OUT -> EnumSet.noneOf(SettlementState.class);
    };
  }
}
