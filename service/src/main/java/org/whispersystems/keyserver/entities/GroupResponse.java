/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;
import org.whispersystems.keyserver.storage.Group;

public record GroupResponse(UUID id,
                            String title,
                            @Nullable String about,
                            long createdBy,
                            int maxParticipants,
                            @Schema(description = "The group's current epoch; clients derive a new group key whenever it changes")
                            long epoch,
                            int activeMemberCount,
                            boolean closed,
                            Instant createdAt,
                            Instant updatedAt,
                            @Nullable Instant epochChangedAt,
                            @Nullable Instant lastMessageAt) {

  public static GroupResponse fromGroup(final Group group) {
    return new GroupResponse(group.id(), group.title(), group.about(), group.createdBy(), group.maxParticipants(),
        group.epoch(), group.activeMemberCount(), group.closed(), group.createdAt(), group.updatedAt(),
        group.epochChangedAt(), group.lastMessageAt());
  }
}
