package com.sidexkit.engine.executor.venue;

import com.sidexkit.engine.domain.MarketRef;
import com.sidexkit.engine.domain.Quote;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.domain.VenueCredentials;
import com.sidexkit.engine.settlement.Settlement;

import java.util.Optional;

/**
 * One trading venue behind the common execution pipeline. The coordinator calls the stages in
 * declaration order and owns the terminal settlement transition: an adapter may move the
 * tracker to {@code PENDING} while it waits, but reports the terminal state through the
 * returned {@link Settlement}.
 *
 * @param <K> parsed signing key
 * @param <M> resolved market
 * @param <O> unsigned venue order
 */
public interface VenueAdapter<K, M extends MarketRef, O> {

  Venue venue();

  /**
   * Parses and validates key material. Must not touch the network.
   */
  K authenticate(VenueCredentials credentials);

  M resolveMarket(TradeIntent intent, ExecutionContext ctx);

  /**
   * Venue-side setup before ordering, such as leverage or position lookup. May decide that
   * there is nothing to do.
   */
  Preparation prepare(TradeIntent intent, K key, M market, ExecutionContext ctx);

  default Optional<Quote> quote(TradeIntent intent, M market, Preparation preparation, ExecutionContext ctx) {
    return Optional.empty();
  }

  O buildOrder(TradeIntent intent, K key, M market, Preparation preparation, Quote quote, ExecutionContext ctx);

  SignedOrder<O> sign(O order, K key, ExecutionContext ctx);

  Submission submit(SignedOrder<O> order, ExecutionContext ctx);

  Settlement confirm(TradeIntent intent, Submission submission, ExecutionContext ctx);
}
