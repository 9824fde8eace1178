/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

public record GroupParticipant(UUID groupId,
                               long userId,
                               GroupRole role,
                               boolean banned,
                               Instant joinedAt,
                               @Nullable Instant muteUntil) {

  public boolean isActive() {
    return !banned;
  }
}
