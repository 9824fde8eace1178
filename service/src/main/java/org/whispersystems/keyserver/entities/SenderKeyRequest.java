/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record SenderKeyRequest(
    @NotNull
    UUID deviceId,

    @NotBlank
    @Size(max = 128)
    @Schema(description = "Opaque identifier of the sender key distributed for this epoch")
    String senderKeyId,

    @PositiveOrZero
    int chainIndex,

    @NotNull
    @Schema(description = "The epoch the sender key was generated for; must be the group's current epoch")
    Long groupEpoch) {
}
