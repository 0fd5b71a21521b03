package com.sidexkit.engine.executor.venue.jupiter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sidexkit.engine.crypto.Base58;
import org.web3j.utils.Numeric;

import java.util.regex.Pattern;

/**
 * Encodings a Solana secret key is accepted in, tried in declaration order.
 */
public enum SolanaKeyDecoder {

  HEX {
    @Override
    public KeyDecodeAttempt decode(String raw) {
      String hex = Numeric.cleanHexPrefix(raw);
      if (!HEX_CHARS.matcher(hex).matches() || hex.length() % 2 != 0) {
        return KeyDecodeAttempt.failure(name(), "not hex");
      }
      return KeyDecodeAttempt.success(name(), Numeric.hexStringToByteArray(hex));
    }
  },

  BASE58 {
    @Override
    public KeyDecodeAttempt decode(String raw) {
      try {
        return KeyDecodeAttempt.success(name(), Base58.decode(raw));
      } catch (IllegalArgumentException e) {
        return KeyDecodeAttempt.failure(name(), "not base58");
      }
    }
  },

  JSON_ARRAY {
    @Override
    public KeyDecodeAttempt decode(String raw) {
      if (!raw.startsWith("[")) {
        return KeyDecodeAttempt.failure(name(), "not a json array");
      }
      JsonNode array;
      try {
        array = JSON.readTree(raw);
      } catch (Exception e) {
        return KeyDecodeAttempt.failure(name(), "unparseable json");
      }
      byte[] out = new byte[array.size()];
      for (int i = 0; i < array.size(); i++) {
        JsonNode b = array.get(i);
        if (!b.isInt() || b.intValue() < 0 || b.intValue() > 255) {
          return KeyDecodeAttempt.failure(name(), "element " + i + " is not a byte");
        }
        out[i] = (byte) b.intValue();
      }
      return KeyDecodeAttempt.success(name(), out);
    }
  };

  private static final Pattern HEX_CHARS = Pattern.compile("[0-9a-fA-F]+");
  private static final ObjectMapper JSON = new ObjectMapper();

  public abstract KeyDecodeAttempt decode(String raw);
}
