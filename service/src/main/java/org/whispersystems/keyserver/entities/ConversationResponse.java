/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nullable;
import org.whispersystems.keyserver.storage.ConversationsManager.ConversationView;

public record ConversationResponse(UUID id,
                                   Instant createdAt,
                                   @Nullable Instant lastMessageAt,
                                   List<Participant> participants,
                                   boolean created) {

  public record Participant(long userId, List<UUID> deviceIds) {
  }

  public static ConversationResponse fromView(final ConversationView view) {
    return new ConversationResponse(view.conversation().id(),
        view.conversation().createdAt(),
        view.conversation().lastMessageAt(),
        view.participants().stream()
            .map(participant -> new Participant(participant.userId(), participant.deviceIds()))
            .toList(),
        view.created());
  }
}
