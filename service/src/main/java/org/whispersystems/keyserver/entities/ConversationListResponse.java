/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nullable;

public record ConversationListResponse(List<Summary> conversations) {

  public record Summary(UUID id, long peerUserId, Instant createdAt, @Nullable Instant lastMessageAt,
                        int unreadCount) {
  }
}
