/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

public record StoredMessage(UUID id,
                            ThreadType threadType,
                            UUID threadId,
                            long senderUserId,
                            UUID senderDeviceId,
                            byte[] ciphertext,
                            int proto,
                            @Nullable Long groupEpoch,
                            Instant createdAt,
                            @Nullable String clientMessageId) {
}
