/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

/**
 * Devices only ever move from {@link #ACTIVE} to {@link #REVOKED}.
 */
public enum DeviceStatus {
  ACTIVE,
  REVOKED
}
