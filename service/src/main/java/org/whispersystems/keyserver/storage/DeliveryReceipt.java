/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Each timestamp is set at most once. A receipt may be read without ever having been marked delivered.
 */
public record DeliveryReceipt(UUID messageId,
                              long recipientUserId,
                              @Nullable Instant deliveredAt,
                              @Nullable Instant readAt) {
}
