/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

public record GroupBan(UUID groupId, long userId, long bannedBy, @Nullable String reason, Instant bannedAt) {
}
