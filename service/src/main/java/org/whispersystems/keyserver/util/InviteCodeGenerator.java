/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.util;

import java.security.SecureRandom;
import java.util.function.Supplier;

/**
 * Generates short random invite codes from an alphabet without easily-confused characters.
 */
public class InviteCodeGenerator implements Supplier<String> {

  private static final char[] ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz23456789".toCharArray();

  private final SecureRandom random = new SecureRandom();
  private final int length;

  public InviteCodeGenerator(final int length) {
    this.length = length;
  }

  @Override
  public String get() {
    final StringBuilder code = new StringBuilder(length);

    for (int i = 0; i < length; i++) {
      code.append(ALPHABET[random.nextInt(ALPHABET.length)]);
    }

    return code.toString();
  }
}
