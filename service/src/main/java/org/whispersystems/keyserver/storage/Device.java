/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

public record Device(UUID id,
                     long ownerUserId,
                     String name,
                     DeviceStatus status,
                     Instant createdAt,
                     @Nullable Instant lastSeenAt) {

  public boolean isActive() {
    return status == DeviceStatus.ACTIVE;
  }

  public boolean isOwnedBy(final long userId) {
    return ownerUserId == userId;
  }
}
