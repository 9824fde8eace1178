/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nullable;

public record UploadKeyBundleRequest(
    @Nullable
    @Schema(description = "The device to upload keys for; if absent, a new device is registered for the caller")
    UUID deviceId,

    @NotBlank
    @Size(max = 64)
    @Schema(description = "A display name for the device")
    String name,

    @NotBlank
    @Schema(description = "The device's base64-encoded public identity key")
    String identityKey,

    @NotBlank
    @Schema(description = "The device's base64-encoded signed prekey")
    String signedPreKey,

    @NotBlank
    @Schema(description = "Base64-encoded signature of the signed prekey by the identity key")
    String signedPreKeySignature,

    @NotNull
    @Schema(description = """
        Base64-encoded one-time prekeys. Replaces every unclaimed one-time prekey stored for the device; must hold at
        least one key and no more than the configured pool size.
        """)
    List<@NotBlank String> preKeys) {
}
