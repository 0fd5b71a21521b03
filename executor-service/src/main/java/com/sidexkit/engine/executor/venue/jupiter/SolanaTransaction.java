package com.sidexkit.engine.executor.venue.jupiter;

import com.sidexkit.engine.crypto.Base58;
import com.sidexkit.engine.crypto.Ed25519Keypair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

/**
 * Wire-format Solana transaction, legacy or versioned: a compact-u16 signature count, the
 * 64-byte signature slots, then the message. Only the signature slots are ever rewritten.
 */
public final class SolanaTransaction {

  private static final int SIGNATURE_LENGTH = 64;
  private static final int PUBKEY_LENGTH = 32;

  private final byte[] raw;
  private final int signaturesOffset;
  private final int signatureCount;
  private final int messageOffset;
  private final boolean versioned;
  private final List<byte[]> requiredSigners;

  private SolanaTransaction(byte[] raw, int signaturesOffset, int signatureCount, int messageOffset,
                            boolean versioned, List<byte[]> requiredSigners) {
    this.raw = raw;
    this.signaturesOffset = signaturesOffset;
    this.signatureCount = signatureCount;
    this.messageOffset = messageOffset;
    this.versioned = versioned;
    this.requiredSigners = requiredSigners;
  }

  public static SolanaTransaction fromBase64(String base64) {
    try {
      return parse(Base64.getDecoder().decode(base64));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("malformed transaction: " + e.getMessage(), e);
    }
  }

  public static SolanaTransaction parse(byte[] bytes) {
    int[] sigCount = readCompactU16(bytes, 0);
    int signaturesOffset = sigCount[1];
    int messageOffset = signaturesOffset + sigCount[0] * SIGNATURE_LENGTH;
    require(bytes.length > messageOffset, "truncated signatures");

    int pos = messageOffset;
    boolean versioned = (bytes[pos] & 0x80) != 0;
    if (versioned) {
      require((bytes[pos] & 0x7f) == 0, "unsupported message version " + (bytes[pos] & 0x7f));
      pos++;
    }
    require(bytes.length >= pos + 3, "truncated message header");
    int numRequired = bytes[pos] & 0xff;
    pos += 3;
    require(numRequired == sigCount[0], "signature count " + sigCount[0] + " != required signers " + numRequired);

    int[] keyCount = readCompactU16(bytes, pos);
    pos += keyCount[1];
    require(keyCount[0] >= numRequired, "fewer account keys than required signers");
    require(bytes.length >= pos + keyCount[0] * PUBKEY_LENGTH, "truncated account keys");
    List<byte[]> signers = new ArrayList<>(numRequired);
    for (int i = 0; i < numRequired; i++) {
      int start = pos + i * PUBKEY_LENGTH;
      signers.add(Arrays.copyOfRange(bytes, start, start + PUBKEY_LENGTH));
    }
    return new SolanaTransaction(bytes.clone(), signaturesOffset, sigCount[0], messageOffset, versioned, List.copyOf(signers));
  }

  public boolean isVersioned() {
    return versioned;
  }

  public int signatureCount() {
    return signatureCount;
  }

  public byte[] message() {
    return Arrays.copyOfRange(raw, messageOffset, raw.length);
  }

  public byte[] signature(int index) {
    int start = signaturesOffset + index * SIGNATURE_LENGTH;
    return Arrays.copyOfRange(raw, start, start + SIGNATURE_LENGTH);
  }

  /**
   * The transaction id: base58 of the fee payer's signature.
   */
  public String id() {
    return Base58.encode(signature(0));
  }

  public int signerIndex(byte[] publicKey) {
    for (int i = 0; i < requiredSigners.size(); i++) {
      if (Arrays.equals(requiredSigners.get(i), publicKey)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Returns a copy with {@code keypair}'s signature over the message in its slot.
   *
   * @throws IllegalArgumentException when the key is not among the required signers
   */
  public SolanaTransaction sign(Ed25519Keypair keypair) {
    int index = signerIndex(keypair.publicKey());
    if (index < 0) {
      throw new IllegalArgumentException("transaction does not require a signature from " + keypair.publicKeyBase58());
    }
    byte[] signature = keypair.sign(message());
    byte[] signed = raw.clone();
    System.arraycopy(signature, 0, signed, signaturesOffset + index * SIGNATURE_LENGTH, SIGNATURE_LENGTH);
    return new SolanaTransaction(signed, signaturesOffset, signatureCount, messageOffset, versioned, requiredSigners);
  }

  public String toBase64() {
    return Base64.getEncoder().encodeToString(raw);
  }

  /**
   * @return {value, bytesRead}
   */
  static int[] readCompactU16(byte[] bytes, int offset) {
    int value = 0;
    for (int i = 0; i < 3; i++) {
      require(bytes.length > offset + i, "truncated compact-u16");
      int b = bytes[offset + i] & 0xff;
      value |= (b & 0x7f) << (7 * i);
      if ((b & 0x80) == 0) {
        return new int[] {value, i + 1};
      }
    }
    throw new IllegalArgumentException("malformed transaction: compact-u16 longer than 3 bytes");
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new IllegalArgumentException("malformed transaction: " + message);
    }
  }
}
