/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import javax.annotation.Nullable;
import org.whispersystems.keyserver.storage.InviteType;

public record CreateInviteRequest(
    @NotNull
    @Schema(description = "link invites may be redeemed by anyone holding the code; direct invites only by the target")
    InviteType type,

    @Nullable
    @Schema(description = "Required for direct invites")
    Long targetUserId,

    @Nullable
    @Schema(description = "Defaults to the configured invite lifetime")
    Instant expiresAt,

    @Nullable
    @Schema(description = "Maximum number of redemptions; unlimited if absent")
    Integer maxUses) {
}
