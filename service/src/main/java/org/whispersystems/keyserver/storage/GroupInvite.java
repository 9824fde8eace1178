/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

public record GroupInvite(UUID id,
                          UUID groupId,
                          long createdBy,
                          InviteType type,
                          String code,
                          Instant expiresAt,
                          @Nullable Integer maxUses,
                          int uses,
                          @Nullable Long targetUserId,
                          Instant createdAt) {

  public boolean isExpired(final Instant now) {
    return !expiresAt.isAfter(now);
  }

  public boolean isExhausted() {
    return maxUses != null && uses >= maxUses;
  }
}
