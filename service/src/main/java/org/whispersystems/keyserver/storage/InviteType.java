/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

public enum InviteType {
  /** Redeemable by anyone holding the code */
  LINK,
  /** Redeemable only by the target user */
  DIRECT
}
