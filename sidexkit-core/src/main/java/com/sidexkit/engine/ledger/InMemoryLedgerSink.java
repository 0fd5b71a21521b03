package com.sidexkit.engine.ledger;

import com.sidexkit.engine.domain.ExecutionResult;
import com.sidexkit.engine.domain.Venue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory ledger keeping the most recent records, newest last.
 */
public final class InMemoryLedgerSink implements LedgerSink {

  private static final int DEFAULT_CAPACITY = 1_000;

  private final int capacity;
  private final Deque<ExecutionResult> results = new ArrayDeque<>();
  private final Deque<VenueTraceEntry> traces = new ArrayDeque<>();

  public InMemoryLedgerSink() {
    this(DEFAULT_CAPACITY);
  }

  public InMemoryLedgerSink(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  @Override
  public synchronized void trace(VenueTraceEntry entry) {
    if (traces.size() == capacity) {
      traces.removeFirst();
    }
    traces.addLast(entry);
  }

  @Override
  public synchronized void append(ExecutionResult result) {
    if (results.size() == capacity) {
      results.removeFirst();
    }
    results.addLast(result);
  }

  public synchronized List<ExecutionResult> results() {
    return List.copyOf(results);
  }

  /**
   * Newest first, at most {@code limit} entries.
   */
  public synchronized List<ExecutionResult> recent(int limit) {
    int safeLimit = Math.max(0, Math.min(capacity, limit));
    List<ExecutionResult> out = new ArrayList<>(safeLimit);
    var it = results.descendingIterator();
    while (it.hasNext() && out.size() < safeLimit) {
      out.add(it.next());
    }
    return out;
  }

  public synchronized List<VenueTraceEntry> traces() {
    return List.copyOf(traces);
  }

  public synchronized List<VenueTraceEntry> traces(Venue venue) {
    return traces.stream().filter(t -> t.venue() == venue).toList();
  }
}
