/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.limits;

import java.time.Clock;
import java.util.UUID;
import org.jdbi.v3.core.Handle;
import org.whispersystems.keyserver.configuration.RateLimitsConfiguration;
import org.whispersystems.keyserver.controllers.RateLimitExceededException;
import org.whispersystems.keyserver.storage.Messages;

public class RateLimiters {

  private final RateLimiter messagesLimiter;
  private final RateLimiter conversationBurstLimiter;

  public RateLimiters(final RateLimiter messagesLimiter, final RateLimiter conversationBurstLimiter) {
    this.messagesLimiter = messagesLimiter;
    this.conversationBurstLimiter = conversationBurstLimiter;
  }

  public static RateLimiters create(final RateLimitsConfiguration configuration, final Messages messages,
      final Clock clock) {

    return new RateLimiters(
        new PersistedWindowRateLimiter("messages", configuration::getMessages,
            (handle, senderUserId, threadId, since, limit) -> messages.getUsageSince(handle, senderUserId, since, limit),
            clock),
        new PersistedWindowRateLimiter("conversationBurst", configuration::getConversationBurst,
            messages::getUsageSince, clock));
  }

  /**
   * Checks both the sender's global window and the sender's window within the thread. Must run in the transaction
   * that stores the message, after the sender has been locked.
   */
  public void validateSend(final Handle handle, final long senderUserId, final UUID threadId)
      throws RateLimitExceededException {

    messagesLimiter.validate(handle, senderUserId, threadId);
    conversationBurstLimiter.validate(handle, senderUserId, threadId);
  }
}
