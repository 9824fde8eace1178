/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.time.Instant;
import java.util.UUID;
import org.whispersystems.keyserver.storage.SenderKeyRecord;

public record SenderKeyResponse(UUID groupId,
                                long senderUserId,
                                UUID senderDeviceId,
                                long groupEpoch,
                                String senderKeyId,
                                int chainIndex,
                                Instant rotatedAt) {

  public static SenderKeyResponse fromRecord(final SenderKeyRecord record) {
    return new SenderKeyResponse(record.groupId(), record.senderUserId(), record.senderDeviceId(), record.groupEpoch(),
        record.senderKeyId(), record.chainIndex(), record.rotatedAt());
  }
}
