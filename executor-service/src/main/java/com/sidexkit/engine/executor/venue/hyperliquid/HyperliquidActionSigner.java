package com.sidexkit.engine.executor.venue.hyperliquid;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * L1 action signing. The action is msgpack-encoded, hashed together with the nonce and the
 * optional vault address, and the hash is signed as the {@code connectionId} of an EIP-712
 * {@code Agent} message in the fixed {@code Exchange} domain.
 */
public final class HyperliquidActionSigner {

  private static final int CHAIN_ID = 1337;
  private static final String VERIFYING_CONTRACT = "0x0000000000000000000000000000000000000000";

  private static final byte[] DOMAIN_TYPEHASH = Hash.sha3(
      "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)".getBytes(StandardCharsets.UTF_8));
  private static final byte[] AGENT_TYPEHASH = Hash.sha3(
      "Agent(string source,bytes32 connectionId)".getBytes(StandardCharsets.UTF_8));
  private static final byte[] DOMAIN_SEPARATOR = domainSeparator();

  private final ObjectMapper msgpack;

  public HyperliquidActionSigner() {
    this(new ObjectMapper(new MessagePackFactory()));
  }

  public HyperliquidActionSigner(ObjectMapper msgpack) {
    this.msgpack = msgpack;
  }

  byte[] pack(Object action) {
    try {
      return msgpack.writeValueAsBytes(action);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed msgpack encoding of " + action.getClass().getSimpleName(), e);
    }
  }

  public byte[] actionHash(Object action, long nonce, String vaultAddress) {
    byte[] packed = pack(action);
    ByteArrayOutputStream out = new ByteArrayOutputStream(packed.length + 29);
    out.writeBytes(packed);
    out.writeBytes(ByteBuffer.allocate(Long.BYTES).putLong(nonce).array());
    if (vaultAddress == null || vaultAddress.isBlank()) {
      out.write(0);
    } else {
      byte[] vault = Numeric.hexStringToByteArray(vaultAddress);
      if (vault.length != 20) {
        throw new IllegalArgumentException("vault address must be 20 bytes");
      }
      out.write(1);
      out.writeBytes(vault);
    }
    return Hash.sha3(out.toByteArray());
  }

  /**
   * EIP-712 digest of {@code Agent{source, connectionId}}; {@code source} is "a" on mainnet, "b" on testnet.
   */
  public static byte[] agentDigest(byte[] connectionId, boolean mainnet) {
    byte[] source = Hash.sha3((mainnet ? "a" : "b").getBytes(StandardCharsets.UTF_8));
    byte[] structHash = Hash.sha3(concat(AGENT_TYPEHASH, source, connectionId));
    return Hash.sha3(concat(new byte[] {0x19, 0x01}, DOMAIN_SEPARATOR, structHash));
  }

  public HyperliquidActions.Signature sign(Credentials credentials, Object action, long nonce, String vaultAddress, boolean mainnet) {
    byte[] digest = agentDigest(actionHash(action, nonce, vaultAddress), mainnet);
    Sign.SignatureData sig = Sign.signMessage(digest, credentials.getEcKeyPair(), false);
    return new HyperliquidActions.Signature(
        Numeric.toHexString(sig.getR()),
        Numeric.toHexString(sig.getS()),
        sig.getV()[0] & 0xff
    );
  }

  private static byte[] domainSeparator() {
    return Hash.sha3(concat(
        DOMAIN_TYPEHASH,
        Hash.sha3("Exchange".getBytes(StandardCharsets.UTF_8)),
        Hash.sha3("1".getBytes(StandardCharsets.UTF_8)),
        Numeric.toBytesPadded(BigInteger.valueOf(CHAIN_ID), 32),
        Numeric.toBytesPadded(Numeric.toBigInt(VERIFYING_CONTRACT), 32)
    ));
  }

  private static byte[] concat(byte[]... parts) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (byte[] part : parts) {
      out.writeBytes(part);
    }
    return out.toByteArray();
  }
}
