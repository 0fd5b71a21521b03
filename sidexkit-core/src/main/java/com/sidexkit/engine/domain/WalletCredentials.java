package com.sidexkit.engine.domain;

/**
 * @param privateKey    signing key, in any encoding the venue adapter accepts
 * @param walletAddress account address when it differs from the signing key's own address
 */
public record WalletCredentials(String privateKey, String walletAddress) implements VenueCredentials {

  public WalletCredentials(String privateKey) {
    this(privateKey, null);
  }

  @Override
  public String toString() {
    return "WalletCredentials[privateKey=****, walletAddress=" + walletAddress + "]";
  }
}
