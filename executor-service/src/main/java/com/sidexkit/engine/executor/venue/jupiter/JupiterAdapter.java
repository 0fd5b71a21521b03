package com.sidexkit.engine.executor.venue.jupiter;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sidexkit.engine.crypto.Base58;
import com.sidexkit.engine.crypto.Ed25519Keypair;
import com.sidexkit.engine.domain.Quote;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.Venue;
import com.sidexkit.engine.domain.VenueCredentials;
import com.sidexkit.engine.domain.WalletCredentials;
import com.sidexkit.engine.error.InvalidCredentialsException;
import com.sidexkit.engine.error.InvalidIntentException;
import com.sidexkit.engine.error.MarketNotFoundException;
import com.sidexkit.engine.error.VenueRejectedException;
import com.sidexkit.engine.error.VenueTransportException;
import com.sidexkit.engine.executor.config.ExecutorProperties;
import com.sidexkit.engine.executor.venue.ExecutionContext;
import com.sidexkit.engine.executor.venue.Preparation;
import com.sidexkit.engine.executor.venue.SignedOrder;
import com.sidexkit.engine.executor.venue.Submission;
import com.sidexkit.engine.executor.venue.VenueAdapter;
import com.sidexkit.engine.settlement.Settlement;
import com.sidexkit.engine.settlement.SettlementState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spot swaps on Solana routed through the Jupiter aggregator. Opens trade {@code amount} of
 * the input token; closes liquidate the whole token balance into the quote mint.
 */
@Component
@Slf4j
public class JupiterAdapter implements VenueAdapter<Ed25519Keypair, SolanaMarket, JupiterSwapOrder> {

  static final String NO_POSITION = "no position to close";
  private static final List<String> COMMITMENTS = List.of("processed", "confirmed", "finalized");
  private static final BigInteger NATIVE_SOL_RESERVE = BigInteger.valueOf(10_000_000L);
  private static final String EXPLORER_TX_URL = "https://solscan.io/tx/";

  private final JupiterApiClient jupiter;
  private final SolanaRpcClient rpc;
  private final ExecutorProperties.Jupiter config;

  public JupiterAdapter(JupiterApiClient jupiter, SolanaRpcClient rpc, ExecutorProperties properties) {
    this.jupiter = jupiter;
    this.rpc = rpc;
    this.config = properties.jupiter();
  }

  @Override
  public Venue venue() {
    return Venue.SOLANA_JUPITER;
  }

  @Override
  public Ed25519Keypair authenticate(VenueCredentials credentials) {
    if (!(credentials instanceof WalletCredentials wallet)) {
      throw new InvalidCredentialsException("solana requires a wallet private key");
    }
    Ed25519Keypair keypair = SolanaKeyParser.parse(wallet.privateKey());
    if (wallet.walletAddress() != null && !wallet.walletAddress().isBlank()
        && !wallet.walletAddress().equals(keypair.publicKeyBase58())) {
      throw new InvalidCredentialsException("wallet address does not match private key");
    }
    return keypair;
  }

  @Override
  public SolanaMarket resolveMarket(TradeIntent intent, ExecutionContext ctx) {
    String quoteMint = config.quoteMint();
    String symbol = intent.symbol().trim();
    Optional<SolanaTokens.Token> alias = SolanaTokens.bySymbol(symbol);
    String tokenMint = alias.map(SolanaTokens.Token::mint).orElse(symbol);
    if (alias.isEmpty() && !isMint(tokenMint)) {
      throw new MarketNotFoundException(symbol, "not a known token or mint address: " + symbol);
    }
    if (tokenMint.equals(quoteMint)) {
      throw new InvalidIntentException("cannot swap the quote mint into itself: " + symbol);
    }
    int tokenDecimals = alias.map(SolanaTokens.Token::decimals).orElseGet(() -> decimals(tokenMint, ctx));
    int quoteDecimals = decimals(quoteMint, ctx);

    boolean buy = !intent.isClose() && intent.side().isBuy();
    SolanaMarket market = buy
        ? new SolanaMarket(tokenMint, quoteMint, tokenMint, quoteDecimals, tokenDecimals)
        : new SolanaMarket(tokenMint, tokenMint, quoteMint, tokenDecimals, quoteDecimals);
    log.info("jupiter market resolved symbol={} input={} output={}", symbol, market.inputMint(), market.outputMint());
    return market;
  }

  @Override
  public Preparation prepare(TradeIntent intent, Ed25519Keypair key, SolanaMarket market, ExecutionContext ctx) {
    if (!intent.isClose()) {
      BigInteger raw = intent.amount().movePointRight(market.inputDecimals()).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
      if (raw.signum() <= 0) {
        throw new InvalidIntentException("amount %s is below one base unit".formatted(intent.amount().toPlainString()));
      }
      return Preparation.proceed(raw.toString(), intent.amount());
    }
    BigInteger balance = closableBalance(key.publicKeyBase58(), market, ctx);
    if (balance.signum() <= 0) {
      log.info("jupiter close skipped owner={} mint={} reason=zero_balance", key.publicKeyBase58(), market.tokenMint());
      return Preparation.skip(NO_POSITION);
    }
    return Preparation.proceed(balance.toString(), new BigDecimal(balance).movePointLeft(market.inputDecimals()));
  }

  private BigInteger closableBalance(String owner, SolanaMarket market, ExecutionContext ctx) {
    if (SolanaTokens.SOL_MINT.equals(market.tokenMint())) {
      return rpc.lamports(owner, ctx).subtract(NATIVE_SOL_RESERVE).max(BigInteger.ZERO);
    }
    return rpc.tokenBalance(owner, market.tokenMint(), market.inputDecimals(), ctx).amount();
  }

  @Override
  public Optional<Quote> quote(TradeIntent intent, SolanaMarket market, Preparation preparation, ExecutionContext ctx) {
    Integer maxSlippage = intent.constraints().maxSlippageBps();
    int slippageBps = maxSlippage != null
        ? maxSlippage
        : intent.isClose() ? config.closeSlippageBps() : config.openSlippageBps();
    Quote quote = jupiter.quote(market.inputMint(), market.outputMint(), new BigInteger(preparation.quantity()), slippageBps, ctx);
    log.info("jupiter quote in={} out={} impactPct={} route={} slippageBps={}",
        quote.inputAmount(), quote.outputAmount(), quote.priceImpact(), quote.route(), slippageBps);
    return Optional.of(quote);
  }

  @Override
  public JupiterSwapOrder buildOrder(TradeIntent intent, Ed25519Keypair key, SolanaMarket market, Preparation preparation, Quote quote, ExecutionContext ctx) {
    String unsigned = jupiter.swapTransaction(quote, key.publicKeyBase58(), ctx);
    try {
      return new JupiterSwapOrder(market, quote, SolanaTransaction.fromBase64(unsigned));
    } catch (IllegalArgumentException e) {
      throw new VenueRejectedException(Venue.SOLANA_JUPITER, "BAD_TRANSACTION", "unusable swap transaction: " + e.getMessage(), ctx.lastResponse());
    }
  }

  @Override
  public SignedOrder<JupiterSwapOrder> sign(JupiterSwapOrder order, Ed25519Keypair key, ExecutionContext ctx) {
    SolanaTransaction signed;
    try {
      signed = order.transaction().sign(key);
    } catch (IllegalArgumentException e) {
      throw new VenueRejectedException(Venue.SOLANA_JUPITER, "SIGNER_MISMATCH", e.getMessage(), ctx.lastResponse());
    }
    return new SignedOrder<>(order, signed.toBase64(), signed.id());
  }

  /**
   * Broadcasts with a bounded number of transport-level attempts. Resending identical signed
   * bytes cannot double-spend; a JSON-RPC error on the first attempt is final.
   *
   * <p>The signature is known before sending, so once a send may have reached the node the
   * swap is reported as broadcast and its fate is left to {@link #confirm}.
   */
  @Override
  public Submission submit(SignedOrder<JupiterSwapOrder> order, ExecutionContext ctx) {
    String payload = order.consume();
    String expected = order.signature();
    int attempts = config.broadcastAttempts();
    boolean unacknowledged = false;
    boolean acknowledged = false;
    String signature = null;
    for (int attempt = 0; attempt < attempts && signature == null; attempt++) {
      if (attempt > 0 && !backoff(attempt, attempts, expected)) {
        break;
      }
      try {
        signature = rpc.sendTransaction(payload, ctx);
        acknowledged = true;
      } catch (VenueTransportException e) {
        unacknowledged = true;
        log.warn("broadcast failed (attempt {}/{}) tx={} err={}", attempt + 1, attempts, expected, e.toString());
      } catch (VenueRejectedException e) {
        if (!unacknowledged) {
          throw e;
        }
        log.warn("broadcast retry rejected after an unacknowledged send tx={} err={}", expected, e.getMessage());
        ctx.warn("broadcast retry rejected (%s); an earlier send may have landed".formatted(e.getMessage()));
        signature = expected;
      }
    }
    if (signature == null) {
      log.warn("broadcast unacknowledged after {} attempts tx={}; polling signature", attempts, expected);
      ctx.warn("broadcast unacknowledged; outcome taken from signature status");
      signature = expected;
    }
    if (!signature.equals(expected)) {
      ctx.warn("rpc returned signature %s, expected %s".formatted(signature, expected));
    }

    JupiterSwapOrder swap = order.order();
    Quote quote = swap.quote();
    ObjectNode details = ctx.objectMapper().createObjectNode()
        .put("signature", signature)
        .put("broadcastAcknowledged", acknowledged)
        .put("explorerUrl", EXPLORER_TX_URL + signature)
        .put("inputMint", swap.market().inputMint())
        .put("outputMint", swap.market().outputMint())
        .put("inAmount", quote.inputAmount().toString())
        .put("outAmount", quote.outputAmount().toString())
        .put("priceImpactPct", quote.priceImpact().toPlainString())
        .put("route", quote.route());
    log.info("jupiter swap broadcast tx={} in={} out={}", signature, swap.inputAmount(), swap.outputAmount());
    return new Submission(null, signature, ctx.lastResponse(), tokenAmount(swap), price(swap), details);
  }

  @Override
  public Settlement confirm(TradeIntent intent, Submission submission, ExecutionContext ctx) {
    ctx.advance(SettlementState.PENDING);
    Duration timeout = config.confirmTimeout();
    Duration timeLimit = intent.constraints().timeLimit();
    if (timeLimit != null && timeLimit.compareTo(timeout) < 0) {
      timeout = timeLimit;
    }
    Instant deadline = ctx.clock().instant().plus(timeout);
    String signature = submission.txHash();
    Settlement.SettlementBuilder settlement = Settlement.builder()
        .txHash(signature)
        .executedAmount(submission.expectedAmount())
        .executedPrice(submission.expectedPrice())
        .slippage(new BigDecimal(submission.details().path("priceImpactPct").asText("0")))
        .details(submission.details());

    while (true) {
      try {
        SolanaRpcClient.SignatureStatus status = rpc.signatureStatus(signature, ctx);
        if (status != null && status.failed()) {
          log.warn("jupiter swap failed on-chain tx={} err={}", signature, status.err());
          return settlement.state(SettlementState.FAILED)
              .errorCode("TX_ERROR")
              .error("transaction failed on-chain: " + status.err())
              .executedAmount(BigDecimal.ZERO)
              .executedPrice(BigDecimal.ZERO)
              .build();
        }
        if (status != null && reached(status.confirmationStatus())) {
          log.info("jupiter swap confirmed tx={} status={} slot={}", signature, status.confirmationStatus(), status.slot());
          return settlement.state(SettlementState.CONFIRMED).build();
        }
      } catch (VenueTransportException | VenueRejectedException e) {
        log.warn("signature status poll failed tx={} err={}", signature, e.toString());
      }
      if (!ctx.clock().instant().isBefore(deadline)) {
        break;
      }
      try {
        Thread.sleep(config.pollInterval().toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    log.warn("jupiter swap unconfirmed after {}ms tx={}", timeout.toMillis(), signature);
    return settlement.state(SettlementState.TIMED_OUT)
        .errorCode("CONFIRM_TIMEOUT")
        .error("transaction %s not %s within %dms".formatted(signature, config.commitment(), timeout.toMillis()))
        .build();
  }

  /**
   * @return {@code false} when interrupted; the caller stops resending
   */
  private boolean backoff(int attempt, int attempts, String signature) {
    long backoffMs = config.pollInterval().toMillis() * (1L << (attempt - 1));
    log.info("retrying broadcast (attempt {}/{}) tx={}", attempt + 1, attempts, signature);
    try {
      Thread.sleep(backoffMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("broadcast retry interrupted tx={}", signature);
      return false;
    }
  }

  private boolean reached(String confirmationStatus) {
    int have = COMMITMENTS.indexOf(confirmationStatus);
    int want = COMMITMENTS.indexOf(config.commitment());
    return have >= 0 && have >= Math.max(0, want);
  }

  private int decimals(String mint, ExecutionContext ctx) {
    return SolanaTokens.knownDecimals(mint).orElseGet(() -> rpc.mintDecimals(mint, ctx));
  }

  private static boolean isMint(String candidate) {
    try {
      return Base58.decode(candidate).length == 32;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * Token side of the swap, in human units.
   */
  private static BigDecimal tokenAmount(JupiterSwapOrder swap) {
    return swap.market().buysToken() ? swap.outputAmount() : swap.inputAmount();
  }

  /**
   * Quote-mint units per token.
   */
  private static BigDecimal price(JupiterSwapOrder swap) {
    BigDecimal token = tokenAmount(swap);
    if (token.signum() == 0) {
      return BigDecimal.ZERO;
    }
    BigDecimal quoteSide = swap.market().buysToken() ? swap.inputAmount() : swap.outputAmount();
    return quoteSide.divide(token, MathContext.DECIMAL64);
  }
}
