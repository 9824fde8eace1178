/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import jakarta.validation.constraints.NotNull;

public record CreateConversationRequest(@NotNull Long peerUserId) {
}
