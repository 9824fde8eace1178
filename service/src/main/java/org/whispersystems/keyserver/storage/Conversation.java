/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * A one-to-one conversation. Rows created before pair keys were introduced have a null {@code pairKey}.
 */
public record Conversation(UUID id, @Nullable String pairKey, Instant createdAt, @Nullable Instant lastMessageAt) {
}
