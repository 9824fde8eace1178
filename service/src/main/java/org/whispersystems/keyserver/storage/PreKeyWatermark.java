/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

public enum PreKeyWatermark {
  OK,
  LOW,
  CRITICAL;

  public static PreKeyWatermark of(final int available, final int lowWatermark, final int criticalWatermark) {
    if (available < criticalWatermark) {
      return CRITICAL;
    } else if (available < lowWatermark) {
      return LOW;
    }

    return OK;
  }
}
