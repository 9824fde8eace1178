/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * @param epoch             increases by exactly one whenever the set of members able to decrypt changes
 * @param activeMemberCount projection of the number of non-banned participants, recomputed under the group lock
 */
public record Group(UUID id,
                    String title,
                    @Nullable String about,
                    long createdBy,
                    int maxParticipants,
                    long epoch,
                    int activeMemberCount,
                    boolean closed,
                    Instant createdAt,
                    Instant updatedAt,
                    @Nullable Instant epochChangedAt,
                    @Nullable Instant lastMessageAt) {
}
