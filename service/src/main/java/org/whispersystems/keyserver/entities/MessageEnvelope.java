/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.time.Instant;
import java.util.Base64;
import java.util.UUID;
import javax.annotation.Nullable;
import org.whispersystems.keyserver.storage.StoredMessage;

public record MessageEnvelope(UUID id,
                              String threadType,
                              UUID threadId,
                              long senderUserId,
                              UUID senderDeviceId,
                              String ciphertext,
                              int proto,
                              @Nullable Long groupEpoch,
                              Instant createdAt,
                              @Nullable String clientMessageId) {

  public static MessageEnvelope fromMessage(final StoredMessage message) {
    return new MessageEnvelope(message.id(), message.threadType().name().toLowerCase(), message.threadId(),
        message.senderUserId(), message.senderDeviceId(), Base64.getEncoder().encodeToString(message.ciphertext()),
        message.proto(), message.groupEpoch(), message.createdAt(), message.clientMessageId());
  }
}
