/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.push;

import java.time.Instant;
import java.util.UUID;

/**
 * Channel names and event payloads for live notifications.
 */
public class LiveEvents {

  private LiveEvents() {
  }

  public static final String USER_CHANNEL_PREFIX = "dm:user:";

  public static String userChannel(final long userId) {
    return USER_CHANNEL_PREFIX + userId;
  }

  public static String conversationChannel(final UUID conversationId) {
    return "dm:conversation:" + conversationId;
  }

  public static String groupChannel(final UUID groupId) {
    return "grp:" + groupId;
  }

  public record EpochChanged(String type, UUID groupId, long newEpoch, String reason) {

    public EpochChanged(final UUID groupId, final long newEpoch, final String reason) {
      this("epoch_changed", groupId, newEpoch, reason);
    }
  }

  public record MessageCreated(String type, String threadType, UUID threadId, UUID messageId, long senderUserId,
                               UUID senderDeviceId, int proto, Long groupEpoch, Instant createdAt) {

    public MessageCreated(final String threadType, final UUID threadId, final UUID messageId, final long senderUserId,
        final UUID senderDeviceId, final int proto, final Long groupEpoch, final Instant createdAt) {

      this("message", threadType, threadId, messageId, senderUserId, senderDeviceId, proto, groupEpoch, createdAt);
    }
  }

  public record ReceiptUpdated(String type, UUID messageId, long recipientUserId, String status, Instant at) {

    public ReceiptUpdated(final UUID messageId, final long recipientUserId, final String status, final Instant at) {
      this("receipt", messageId, recipientUserId, status, at);
    }
  }
}
