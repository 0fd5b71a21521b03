package com.sidexkit.engine.settlement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Enforces {@link SettlementState} transitions for a single submission. Not thread-safe;
 * one tracker belongs to one execution.
 */
public final class SettlementTracker {

  private final List<SettlementState> history = new ArrayList<>();
  private final Consumer<SettlementState> listener;

  public SettlementTracker() {
    this(state -> {
    });
  }

  public SettlementTracker(Consumer<SettlementState> listener) {
    this.listener = listener;
  }

  public Optional<SettlementState> current() {
    return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
  }

  public List<SettlementState> history() {
    return List.copyOf(history);
  }

  public boolean isTerminal() {
    return current().map(SettlementState::isTerminal).orElse(false);
  }

  public SettlementState advance(SettlementState next) {
    SettlementState from = current().orElse(null);
    boolean allowed = from == null ? next == SettlementState.BUILT : from.canTransitionTo(next);
    if (!allowed) {
      throw new IllegalStateException("Illegal settlement transition " + from + " -> " + next);
    }
    history.add(next);
    listener.accept(next);
    return next;
  }
}
