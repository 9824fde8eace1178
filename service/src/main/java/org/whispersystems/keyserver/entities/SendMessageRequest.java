/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import javax.annotation.Nullable;

public record SendMessageRequest(
    @NotNull
    @Schema(description = "The sending device; must be one of the caller's active devices")
    UUID deviceId,

    @NotBlank
    @Schema(description = "Base64-encoded ciphertext")
    String ciphertext,

    @NotNull
    @Schema(description = "Envelope type tag. Group messages use 10 (sender-key message) or 11 (sender-key distribution)")
    Integer proto,

    @Nullable
    @Schema(description = "Required for group messages: the epoch the message was encrypted for")
    Long groupEpoch,

    @Nullable
    @Size(max = 64)
    @Schema(description = "Idempotency key; repeating a send with the same key returns the original message")
    String clientMessageId) {
}
