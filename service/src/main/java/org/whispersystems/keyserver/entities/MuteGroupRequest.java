/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import javax.annotation.Nullable;

public record MuteGroupRequest(
    @Nullable
    @Schema(description = "Mute notifications until this time; absent to unmute")
    Instant muteUntil) {
}
