package com.sidexkit.engine.executor.credentials;

import com.sidexkit.engine.domain.ApiKeyCredentials;
import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.VenueCredentials;
import com.sidexkit.engine.domain.WalletCredentials;
import com.sidexkit.engine.error.InvalidCredentialsException;
import com.sidexkit.engine.executor.config.ExecutorProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Uses the intent's own credentials when present, otherwise the ones configured under
 * {@code executor.credentials}.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredCredentialResolver implements CredentialResolver {

  private final @NonNull ExecutorProperties properties;

  @Override
  public VenueCredentials resolve(TradeIntent intent) {
    if (intent.credentials() != null) {
      return intent.credentials();
    }
    ExecutorProperties.Credentials creds = properties.credentials();
    VenueCredentials resolved = switch (intent.venue()) {
      case BYBIT -> isBlank(creds.bybitApiKey()) || isBlank(creds.bybitApiSecret())
          ? null
          : new ApiKeyCredentials(creds.bybitApiKey(), creds.bybitApiSecret());
      case HYPERLIQUID -> isBlank(creds.hyperliquidPrivateKey())
          ? null
          : new WalletCredentials(creds.hyperliquidPrivateKey(), creds.hyperliquidWalletAddress());
      case SOLANA_JUPITER -> isBlank(creds.solanaPrivateKey())
          ? null
          : new WalletCredentials(creds.solanaPrivateKey());
    };
    if (resolved == null) {
      throw new InvalidCredentialsException("no credentials supplied or configured for venue " + intent.venue().id());
    }
    return resolved;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
