/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.auth;

import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import org.whispersystems.keyserver.configuration.CallerAuthConfiguration;
import org.whispersystems.keyserver.util.HmacUtils;

/**
 * Caller tokens are issued by the host application once it has established who the caller is. A token has the form
 * {@code timestamp:signature}, where the signature is a hex-encoded HMAC-SHA256 of {@code userId:timestamp}.
 */
public class CallerTokens {

  private static final String DELIMITER = ":";

  private final byte[] key;
  private final Duration lifetime;
  private final Clock clock;

  public CallerTokens(final CallerAuthConfiguration configuration, final Clock clock) {
    this(HexFormat.of().parseHex(configuration.getTokenKey()), configuration.getTokenLifetime(), clock);
  }

  @VisibleForTesting
  public CallerTokens(final byte[] key, final Duration lifetime, final Clock clock) {
    this.key = key;
    this.lifetime = lifetime;
    this.clock = clock;
  }

  public String generate(final long userId) {
    final long timestamp = clock.instant().getEpochSecond();
    return timestamp + DELIMITER + HmacUtils.hmac256ToHexString(key, userId + DELIMITER + timestamp);
  }

  /**
   * Returns true if the token was issued for the given user and has not outlived its lifetime.
   */
  public boolean verify(final long userId, final String token) {
    final int delimiterIndex = token.indexOf(DELIMITER);

    if (delimiterIndex <= 0) {
      return false;
    }

    final long timestamp;

    try {
      timestamp = Long.parseLong(token.substring(0, delimiterIndex));
    } catch (final NumberFormatException e) {
      return false;
    }

    final Instant issuedAt = Instant.ofEpochSecond(timestamp);

    if (issuedAt.plus(lifetime).isBefore(clock.instant()) || issuedAt.isAfter(clock.instant().plus(lifetime))) {
      return false;
    }

    return HmacUtils.hmacHexStringsEqual(HmacUtils.hmac256ToHexString(key, userId + DELIMITER + timestamp),
        token.substring(delimiterIndex + 1));
  }
}
