/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.UUID;

public record JoinGroupResponse(
    UUID groupId,
    long epoch,

    @Schema(description = "False if the caller was already a member")
    boolean joined) {
}
