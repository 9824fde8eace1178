/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;
import org.whispersystems.keyserver.storage.DeliveryReceipt;

public record ReceiptResponse(UUID messageId, long recipientUserId, @Nullable Instant deliveredAt,
                              @Nullable Instant readAt) {

  public static ReceiptResponse fromReceipt(final DeliveryReceipt receipt) {
    return new ReceiptResponse(receipt.messageId(), receipt.recipientUserId(), receipt.deliveredAt(),
        receipt.readAt());
  }
}
