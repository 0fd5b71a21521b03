package com.sidexkit.engine.executor.credentials;

import com.sidexkit.engine.domain.TradeIntent;
import com.sidexkit.engine.domain.VenueCredentials;

/**
 * Supplies the credentials an intent executes with.
 */
@FunctionalInterface
public interface CredentialResolver {

  VenueCredentials resolve(TradeIntent intent);
}
