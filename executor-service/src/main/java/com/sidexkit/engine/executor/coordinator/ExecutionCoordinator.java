package com.sidexkit.engine.executor.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sidexkit.engine.domain.ErrorKind;
import com.sidexkit.engine.domain.ExecutionError;
import com.sidexkit.engine.domain.ExecutionResult;
import com.sidexkit.engine.domain.ExecutionStage;
import com.sidexkit.engine.domain.ExecutionStatus;
import com.sidexkit.engine.domain.MarketRef;
import com.sidexkit.engine.domain.Quote;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.VenueCredentials;
import com.sidexkit.engine.error.ExecutionException;
import com.sidexkit.engine.error.VenueRejectedException;
import com.sidexkit.engine.executor.credentials.CredentialResolver;
import com.sidexkit.engine.executor.venue.ExecutionContext;
import com.sidexkit.engine.executor.venue.Preparation;
import com.sidexkit.engine.executor.venue.SignedOrder;
import com.sidexkit.engine.executor.venue.Submission;
import com.sidexkit.engine.executor.venue.VenueAdapter;
import com.sidexkit.engine.executor.venue.VenueRegistry;
import com.sidexkit.engine.ledger.LedgerSink;
import com.sidexkit.engine.settlement.Settlement;
import com.sidexkit.engine.settlement.SettlementState;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

/**
 * Runs one {@link TradeIntent} through its venue adapter. Every call produces exactly one
 * {@link ExecutionResult} and one ledger append, whatever stage fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionCoordinator {

  private final @NonNull VenueRegistry venues;
  private final @NonNull CredentialResolver credentials;
  private final @NonNull LedgerSink ledger;
  private final @NonNull ObjectMapper objectMapper;
  private final @NonNull Clock clock;

  public ExecutionResult execute(TradeIntent intent) {
    Objects.requireNonNull(intent, "intent");
    ExecutionContext ctx = new ExecutionContext(intent, ledger, objectMapper, clock);
    log.info("execution start intent={} venue={} action={} symbol={} side={} amount={} leverage={}",
        intent.id(), intent.venue(), intent.action(), intent.symbol(), intent.side(), intent.amount(), intent.leverage());

    ExecutionResult result;
    try {
      ctx.enter(ExecutionStage.VALIDATE);
      intent.validate();
      result = run(venues.adapterFor(intent.venue()), intent, ctx);
    } catch (ExecutionException e) {
      result = failure(ctx, e.toError(), e instanceof VenueRejectedException vr ? vr.response() : null);
      log.warn("execution failed {} lastResponse={}", result.summary(), ctx.lastResponse());
    } catch (RuntimeException e) {
      result = failure(ctx, ExecutionError.of(ErrorKind.INTERNAL, null, e.toString()), null);
      log.error("execution failed unexpectedly {}", result.summary(), e);
    }
    appendSafely(result);
    return result;
  }

  /**
   * Same as {@link #execute}, but a result that is not a success raises after it has been recorded.
   */
  public ExecutionResult executeOrThrow(TradeIntent intent) {
    ExecutionResult result = execute(intent);
    if (!result.success()) {
      throw new ExecutionFailedException(result);
    }
    return result;
  }

  private <K, M extends MarketRef, O> ExecutionResult run(VenueAdapter<K, M, O> adapter, TradeIntent intent, ExecutionContext ctx) {
    ctx.enter(ExecutionStage.AUTHENTICATE);
    VenueCredentials creds = credentials.resolve(intent);
    K key = adapter.authenticate(creds);

    ctx.enter(ExecutionStage.RESOLVE_MARKET);
    M market = adapter.resolveMarket(intent, ctx);

    ctx.enter(ExecutionStage.PREPARE);
    Preparation preparation = adapter.prepare(intent, key, market, ctx);
    if (preparation.skipped()) {
      log.info("execution skipped intent={} venue={} reason={}", intent.id(), intent.venue(), preparation.message());
      return base(ctx)
          .success(true)
          .status(ExecutionStatus.SUCCEEDED)
          .stage(ExecutionStage.COMPLETE)
          .message(preparation.message())
          .build();
    }

    ctx.enter(ExecutionStage.QUOTE);
    Quote quote = adapter.quote(intent, market, preparation, ctx).orElse(null);

    ctx.enter(ExecutionStage.BUILD_ORDER);
    O order = adapter.buildOrder(intent, key, market, preparation, quote, ctx);
    ctx.advance(SettlementState.BUILT);

    ctx.enter(ExecutionStage.SIGN);
    SignedOrder<O> signed = adapter.sign(order, key, ctx);
    ctx.advance(SettlementState.SIGNED);

    ctx.enter(ExecutionStage.SUBMIT);
    Submission submission = adapter.submit(signed, ctx);
    ctx.recordSubmission(submission);
    ctx.advance(SettlementState.BROADCAST);

    ctx.enter(ExecutionStage.CONFIRM);
    Settlement settlement = adapter.confirm(intent, submission, ctx);
    ctx.advance(settlement.state());
    return settled(ctx, settlement);
  }

  private ExecutionResult settled(ExecutionContext ctx, Settlement settlement) {
    ExecutionResult.ExecutionResultBuilder builder = base(ctx)
        .txHash(settlement.txHash())
        .orderId(settlement.orderId())
        .executedAmount(settlement.executedAmount())
        .executedPrice(settlement.executedPrice())
        .fees(settlement.fees())
        .slippage(settlement.slippage())
        .details(settlement.details());
    ExecutionResult result = switch (settlement.state()) {
      case CONFIRMED -> builder
          .success(true)
          .status(ExecutionStatus.SUCCEEDED)
          .stage(ExecutionStage.COMPLETE)
          .build();
      case FAILED -> builder
          .success(false)
          .status(ExecutionStatus.FAILED)
          .stage(ExecutionStage.CONFIRM)
          .error(ExecutionError.of(ErrorKind.SETTLEMENT_FAILED, settlement.errorCode(), settlement.error()))
          .build();
      case TIMED_OUT -> builder
          .success(false)
          .status(ExecutionStatus.UNKNOWN_OUTCOME)
          .stage(ExecutionStage.CONFIRM)
          .message("settlement not confirmed; check the transaction before retrying")
          .error(ExecutionError.of(ErrorKind.SETTLEMENT_TIMEOUT, settlement.errorCode(), settlement.error()))
          .build();
      default -> throw new IllegalStateException("non-terminal settlement " + settlement.state());
    };
    if (result.success()) {
      log.info("execution succeeded {} amount={} price={} elapsedMs={}",
          result.summary(), result.executedAmount(), result.executedPrice(), result.executionTimeMillis());
    } else {
      log.warn("execution settled without success {}", result.summary());
    }
    return result;
  }

  /**
   * Once the order is out, an exception no longer proves it failed.
   */
  private ExecutionResult failure(ExecutionContext ctx, ExecutionError error, JsonNode response) {
    SettlementState state = ctx.settlement().current().orElse(null);
    boolean inFlight = state == SettlementState.BROADCAST || state == SettlementState.PENDING;
    Submission submission = ctx.submission();
    ObjectNode details = objectMapper.createObjectNode();
    if (submission != null && submission.details() != null) {
      details.setAll(submission.details());
    }
    JsonNode raw = response != null ? response : ctx.lastResponse();
    if (raw != null) {
      details.set("venueResponse", raw);
    }
    return base(ctx)
        .success(false)
        .status(inFlight ? ExecutionStatus.UNKNOWN_OUTCOME : ExecutionStatus.FAILED)
        .stage(ctx.stage())
        .orderId(submission == null ? null : submission.orderId())
        .txHash(submission == null ? null : submission.txHash())
        .error(error)
        .details(details.isEmpty() ? null : details)
        .build();
  }

  private ExecutionResult.ExecutionResultBuilder base(ExecutionContext ctx) {
    TradeIntent intent = ctx.intent();
    return ExecutionResult.builder()
        .intentId(intent.id())
        .venue(intent.venue())
        .symbol(intent.symbol())
        .side(intent.side())
        .action(intent.action())
        .executionTimeMillis(ctx.elapsedMillis())
        .warnings(ctx.warnings())
        .timestamp(clock.instant());
  }

  private void appendSafely(ExecutionResult result) {
    try {
      ledger.append(result);
    } catch (Exception e) {
      log.warn("ledger append failed intent={} error={}", result.intentId(), e.toString());
    }
  }
}
