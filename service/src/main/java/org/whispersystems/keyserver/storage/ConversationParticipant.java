/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.util.List;
import java.util.UUID;

/**
 * @param deviceIds cached ids of the participant's active devices; refreshed from the device table before use
 */
public record ConversationParticipant(UUID conversationId, long userId, List<UUID> deviceIds) {
}
