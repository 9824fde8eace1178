/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.UUID;

/**
 * Opaque rotation metadata for one device's sender key in one group epoch. The key itself never reaches the server.
 */
public record SenderKeyRecord(UUID groupId,
                              long senderUserId,
                              UUID senderDeviceId,
                              long groupEpoch,
                              String senderKeyId,
                              int chainIndex,
                              Instant rotatedAt) {
}
