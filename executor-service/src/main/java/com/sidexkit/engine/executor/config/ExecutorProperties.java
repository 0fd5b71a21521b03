package com.sidexkit.engine.executor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "executor")
public record ExecutorProperties(
    @Valid Http http,
    @Valid Bybit bybit,
    @Valid Hyperliquid hyperliquid,
    @Valid Jupiter jupiter,
    @Valid Ledger ledger,
    Credentials credentials
) {

  public ExecutorProperties {
    if (http == null) {
      http = new Http(null, null);
    }
    if (bybit == null) {
      bybit = new Bybit(null, null, null);
    }
    if (hyperliquid == null) {
      hyperliquid = new Hyperliquid(null, null, null, null, null);
    }
    if (jupiter == null) {
      jupiter = new Jupiter(null, null, null, null, null, null, null, null, null, null, null);
    }
    if (ledger == null) {
      ledger = new Ledger(null, null, null, null);
    }
    if (credentials == null) {
      credentials = new Credentials(null, null, null, null, null);
    }
  }

  public record Http(
      @NotNull Duration connectTimeout,
      @NotNull Duration readTimeout
  ) {
    public Http {
      if (connectTimeout == null) {
        connectTimeout = Duration.ofSeconds(5);
      }
      if (readTimeout == null) {
        readTimeout = Duration.ofSeconds(30);
      }
    }
  }

  /**
   * @param recvWindowMillis freshness window the venue applies to signed timestamps
   * @param category         v5 product category; {@code linear} for USDT perpetuals
   */
  public record Bybit(
      @NotBlank String baseUrl,
      @NotNull @Positive Long recvWindowMillis,
      @NotBlank String category
  ) {
    public Bybit {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://api.bybit.com";
      }
      if (recvWindowMillis == null) {
        recvWindowMillis = 5_000L;
      }
      if (category == null || category.isBlank()) {
        category = "linear";
      }
    }
  }

  /**
   * @param marketSlippage fraction added to (buys) or taken off (sells) the mid price when no price is given
   * @param vaultAddress   vault to trade on behalf of, {@code null} for the signer's own account
   * @param crossMargin    margin mode used when the intent carries a leverage
   */
  public record Hyperliquid(
      @NotBlank String baseUrl,
      @NotNull Boolean mainnet,
      @NotNull BigDecimal marketSlippage,
      String vaultAddress,
      @NotNull Boolean crossMargin
  ) {
    public Hyperliquid {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://api.hyperliquid.xyz";
      }
      if (mainnet == null) {
        mainnet = true;
      }
      if (marketSlippage == null) {
        marketSlippage = new BigDecimal("0.05");
      }
      if (crossMargin == null) {
        crossMargin = true;
      }
    }
  }

  /**
   * @param quoteMint         stable asset swaps are priced in and closes liquidate into
   * @param commitment        commitment level a transaction must reach to count as confirmed
   * @param broadcastAttempts transport-level attempts for one signed transaction
   * @param rpcMaxRetries     {@code maxRetries} forwarded to the RPC node's own rebroadcast loop
   */
  public record Jupiter(
      @NotBlank String quoteApiUrl,
      @NotBlank String rpcUrl,
      @NotBlank String quoteMint,
      @NotNull @Min(0) @Max(10_000) Integer openSlippageBps,
      @NotNull @Min(0) @Max(10_000) Integer closeSlippageBps,
      @NotBlank String commitment,
      @NotNull @Min(1) Integer broadcastAttempts,
      @NotNull @Min(0) Integer rpcMaxRetries,
      @NotNull Duration confirmTimeout,
      @NotNull Duration pollInterval,
      @NotNull Boolean skipPreflight
  ) {
    public Jupiter {
      if (quoteApiUrl == null || quoteApiUrl.isBlank()) {
        quoteApiUrl = "https://quote-api.jup.ag/v6";
      }
      if (rpcUrl == null || rpcUrl.isBlank()) {
        rpcUrl = "https://api.mainnet-beta.solana.com";
      }
      if (quoteMint == null || quoteMint.isBlank()) {
        quoteMint = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
      }
      if (openSlippageBps == null) {
        openSlippageBps = 50;
      }
      if (closeSlippageBps == null) {
        closeSlippageBps = 100;
      }
      if (commitment == null || commitment.isBlank()) {
        commitment = "confirmed";
      }
      if (broadcastAttempts == null) {
        broadcastAttempts = 3;
      }
      if (rpcMaxRetries == null) {
        rpcMaxRetries = 3;
      }
      if (confirmTimeout == null) {
        confirmTimeout = Duration.ofSeconds(60);
      }
      if (pollInterval == null) {
        pollInterval = Duration.ofMillis(500);
      }
      if (skipPreflight == null) {
        skipPreflight = false;
      }
    }
  }

  /**
   * @param directory      where {@code <venue>_debug.log} traces and the trade ledger are written
   * @param recentCapacity results kept in memory for the recent-executions endpoint
   */
  public record Ledger(
      @NotNull Boolean enabled,
      @NotBlank String directory,
      @NotBlank String tradesFile,
      @NotNull @Positive Integer recentCapacity
  ) {
    public Ledger {
      if (enabled == null) {
        enabled = true;
      }
      if (directory == null || directory.isBlank()) {
        directory = "ledger";
      }
      if (tradesFile == null || tradesFile.isBlank()) {
        tradesFile = "trades.jsonl";
      }
      if (recentCapacity == null) {
        recentCapacity = 500;
      }
    }
  }

  /**
   * Fallback credentials for intents that arrive without their own.
   */
  public record Credentials(
      String bybitApiKey,
      String bybitApiSecret,
      String hyperliquidPrivateKey,
      String hyperliquidWalletAddress,
      String solanaPrivateKey
  ) {
    @Override
    public String toString() {
      return "Credentials[bybitApiKey=" + (bybitApiKey == null ? "<unset>" : "****")
          + ", hyperliquidWalletAddress=" + hyperliquidWalletAddress + "]";
    }
  }
}
