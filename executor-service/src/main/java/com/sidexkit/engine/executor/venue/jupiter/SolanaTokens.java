package com.sidexkit.engine.executor.venue.jupiter;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Well-known mainnet mints, so the common symbols need no on-chain decimals lookup.
 */
final class SolanaTokens {

  static final String SOL_MINT = "So11111111111111111111111111111111111111112";
  static final String USDC_MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

  record Token(String mint, int decimals) {
  }

  private static final Map<String, Token> BY_SYMBOL = Map.of(
      "SOL", new Token(SOL_MINT, 9),
      "USDC", new Token(USDC_MINT, 6),
      "USDT", new Token("Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB", 6),
      "JUP", new Token("JUPyiwrYJFskUPiHa7hkeR8VUtAeFoSYbKedZNsDvCN", 6),
      "BONK", new Token("DezXAZ8z7PnrnRJjz3wXBoRgixCa6xjnB7YaB1pPB263", 5),
      "WIF", new Token("EKpQGSJtjMFqKZ9KQanSqYXRcF8fBopzLHYxdM65zcjm", 6),
      "RAY", new Token("4k3Dyjzvzp8eMZWUXbBCjEvwSkkk59S5iCNLY3QrkX6R", 6)
  );

  private SolanaTokens() {
  }

  static Optional<Token> bySymbol(String symbol) {
    return Optional.ofNullable(BY_SYMBOL.get(symbol.toUpperCase(Locale.ROOT)));
  }

  static Optional<Integer> knownDecimals(String mint) {
    return BY_SYMBOL.values().stream().filter(t -> t.mint().equals(mint)).map(Token::decimals).findFirst();
  }
}
