package com.sidexkit.engine.ledger;

import com.sidexkit.engine.domain.ExecutionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Fans out to several sinks; a failing delegate does not stop the others.
 */
@Slf4j
public final class CompositeLedgerSink implements LedgerSink {

  private final List<LedgerSink> delegates;

  public CompositeLedgerSink(List<LedgerSink> delegates) {
    this.delegates = List.copyOf(delegates);
  }

  @Override
  public void trace(VenueTraceEntry entry) {
    for (LedgerSink sink : delegates) {
      try {
        sink.trace(entry);
      } catch (RuntimeException e) {
        log.warn("ledger trace failed sink={} error={}", sink.getClass().getSimpleName(), e.toString());
      }
    }
  }

  @Override
  public void append(ExecutionResult result) {
    for (LedgerSink sink : delegates) {
      try {
        sink.append(result);
      } catch (RuntimeException e) {
        log.warn("ledger append failed sink={} intent={} error={}",
            sink.getClass().getSimpleName(), result.intentId(), e.toString());
      }
    }
  }
}
