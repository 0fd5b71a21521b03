package com.sidexkit.engine.ledger;

import com.sidexkit.engine.domain.ExecutionResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class CompositeLedgerSinkTest {

  @Test
  void failingDelegateDoesNotStopTheOthers() {
    LedgerSink broken = new LedgerSink() {
      @Override
      public void trace(VenueTraceEntry entry) {
        throw new IllegalStateException("disk full");
      }

      @Override
      public void append(ExecutionResult result) {
        throw new IllegalStateException("disk full");
      }
    };
    InMemoryLedgerSink memory = new InMemoryLedgerSink();
    CompositeLedgerSink composite = new CompositeLedgerSink(List.of(broken, memory));

    assertThatCode(() -> composite.append(InMemoryLedgerSinkTest.result("x"))).doesNotThrowAnyException();
    assertThat(memory.results()).extracting(ExecutionResult::intentId).containsExactly("x");
  }
}
