/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.util;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

public final class HmacUtils {

  private static final HexFormat HEX = HexFormat.of();

  private static final String HMAC_SHA_256 = "HmacSHA256";

  private static final ThreadLocal<Mac> THREAD_LOCAL_HMAC_SHA_256 = ThreadLocal.withInitial(() -> {
    try {
      return Mac.getInstance(HMAC_SHA_256);
    } catch (NoSuchAlgorithmException e) {
      throw new RuntimeException(e);
    }
  });

  private HmacUtils() {
  }

  public static String hmac256ToHexString(final byte[] key, final String input) {
    try {
      final Mac mac = THREAD_LOCAL_HMAC_SHA_256.get();
      mac.init(new SecretKeySpec(key, HMAC_SHA_256));

      return HEX.formatHex(mac.doFinal(input.getBytes(StandardCharsets.UTF_8)));
    } catch (final InvalidKeyException e) {
      throw new RuntimeException(e);
    }
  }

  public static boolean hmacHexStringsEqual(final String expectedAsHexString, final String actualAsHexString) {
    try {
      return MessageDigest.isEqual(HEX.parseHex(expectedAsHexString), HEX.parseHex(actualAsHexString));
    } catch (final IllegalArgumentException e) {
      return false;
    }
  }
}
