/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

public enum IdentityChangeReason {
  IDENTITY_CHANGE,
  IDENTITY_CHANGE_BLOCK
}
