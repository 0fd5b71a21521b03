package com.sidexkit.engine.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

public final class HmacSha256 {

  private static final String ALGORITHM = "HmacSHA256";

  private HmacSha256() {
  }

  /**
   * Lowercase hex HMAC-SHA256 of {@code data} keyed by {@code secret}, both UTF-8.
   */
  public static String hex(String secret, String data) {
    if (secret == null || secret.isEmpty()) {
      throw new IllegalArgumentException("HMAC secret must not be empty");
    }
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to calculate HMAC-SHA256 signature", e);
    }
  }
}
