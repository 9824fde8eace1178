/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

public enum GroupRole {
  OWNER,
  ADMIN,
  MEMBER;

  public boolean canManageMembers() {
    return this == OWNER || this == ADMIN;
  }
}
