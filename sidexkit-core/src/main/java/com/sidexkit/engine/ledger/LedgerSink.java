package com.sidexkit.engine.ledger;

import com.sidexkit.engine.domain.ExecutionResult;

/**
 * Append-only destination for execution records: a verbose per-venue trace of request and
 * response pairs, and the cross-venue trade ledger with one line per attempt.
 *
 * <p>Implementations may throw; callers treat every failure here as non-fatal.
 */
public interface LedgerSink {

  void trace(VenueTraceEntry entry);

  void append(ExecutionResult result);
}
