/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.util;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Order-independent identifiers for unordered pairs of users.
 */
public class PairKeys {

  private PairKeys() {
  }

  /**
   * Returns the hex-encoded SHA-256 digest of the two ids, smaller first, so {@code of(a, b).equals(of(b, a))}.
   */
  public static String of(final long firstUserId, final long secondUserId) {
    final long low = Math.min(firstUserId, secondUserId);
    final long high = Math.max(firstUserId, secondUserId);

    return DigestUtils.sha256Hex(low + ":" + high);
  }
}
