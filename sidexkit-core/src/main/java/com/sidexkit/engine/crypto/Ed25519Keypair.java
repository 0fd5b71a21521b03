package com.sidexkit.engine.crypto;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.util.Arrays;

/**
 * Ed25519 signing key. Accepts the 32-byte seed or the 64-byte {@code seed || publicKey}
 * layout Solana wallets export; the latter is checked for consistency.
 */
public final class Ed25519Keypair {

  public static final int SEED_LENGTH = Ed25519PrivateKeyParameters.KEY_SIZE;
  public static final int SECRET_KEY_LENGTH = SEED_LENGTH + Ed25519PublicKeyParameters.KEY_SIZE;
  public static final int SIGNATURE_LENGTH = Ed25519PrivateKeyParameters.SIGNATURE_SIZE;

  private final Ed25519PrivateKeyParameters privateKey;
  private final byte[] publicKey;

  private Ed25519Keypair(Ed25519PrivateKeyParameters privateKey) {
    this.privateKey = privateKey;
    this.publicKey = privateKey.generatePublicKey().getEncoded();
  }

  public static Ed25519Keypair fromSeed(byte[] seed) {
    if (seed == null || seed.length != SEED_LENGTH) {
      throw new IllegalArgumentException("Ed25519 seed must be " + SEED_LENGTH + " bytes");
    }
    return new Ed25519Keypair(new Ed25519PrivateKeyParameters(seed, 0));
  }

  /**
   * @param secretKey 32-byte seed or 64-byte seed followed by the matching public key
   */
  public static Ed25519Keypair fromSecretKey(byte[] secretKey) {
    if (secretKey == null) {
      throw new IllegalArgumentException("secret key is required");
    }
    if (secretKey.length == SEED_LENGTH) {
      return fromSeed(secretKey);
    }
    if (secretKey.length != SECRET_KEY_LENGTH) {
      throw new IllegalArgumentException("Ed25519 secret key must be " + SEED_LENGTH + " or "
          + SECRET_KEY_LENGTH + " bytes, got " + secretKey.length);
    }
    Ed25519Keypair keypair = fromSeed(Arrays.copyOfRange(secretKey, 0, SEED_LENGTH));
    byte[] embedded = Arrays.copyOfRange(secretKey, SEED_LENGTH, SECRET_KEY_LENGTH);
    if (!Arrays.equals(keypair.publicKey, embedded)) {
      throw new IllegalArgumentException("Ed25519 secret key does not match its embedded public key");
    }
    return keypair;
  }

  public byte[] publicKey() {
    return publicKey.clone();
  }

  public String publicKeyBase58() {
    return Base58.encode(publicKey);
  }

  public byte[] sign(byte[] message) {
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, privateKey);
    signer.update(message, 0, message.length);
    return signer.generateSignature();
  }

  public static boolean verify(byte[] publicKey, byte[] message, byte[] signature) {
    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
    verifier.update(message, 0, message.length);
    return verifier.verifySignature(signature);
  }

  @Override
  public String toString() {
    return "Ed25519Keypair[publicKey=" + publicKeyBase58() + "]";
  }
}
