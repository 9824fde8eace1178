/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;
import org.whispersystems.keyserver.storage.MessagesManager.SendResult;

public record SendMessageResponse(UUID messageId, Instant createdAt, @Nullable Long groupEpoch, boolean duplicate) {

  public static SendMessageResponse fromResult(final SendResult result) {
    return new SendMessageResponse(result.message().id(), result.message().createdAt(), result.message().groupEpoch(),
        result.duplicate());
  }
}
