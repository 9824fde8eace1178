/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;
import org.whispersystems.keyserver.storage.GroupInvite;

public record InviteResponse(UUID id,
                             UUID groupId,
                             String type,
                             String code,
                             Instant expiresAt,
                             @Nullable Integer maxUses,
                             int uses,
                             @Nullable Long targetUserId,
                             Instant createdAt) {

  public static InviteResponse fromInvite(final GroupInvite invite) {
    return new InviteResponse(invite.id(), invite.groupId(), invite.type().name().toLowerCase(), invite.code(),
        invite.expiresAt(), invite.maxUses(), invite.uses(), invite.targetUserId(), invite.createdAt());
  }
}
