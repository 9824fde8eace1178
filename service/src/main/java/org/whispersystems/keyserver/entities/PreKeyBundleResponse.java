/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nullable;

public record PreKeyBundleResponse(
    @Schema(description = "The user whose keys these are")
    long userId,

    @Schema(description = "One entry for each of the user's active devices")
    List<DeviceBundle> devices) {

  public record DeviceBundle(UUID deviceId,
                             String name,
                             String identityKey,
                             String signedPreKey,
                             String signedPreKeySignature,
                             long bundleVersion,
                             int prekeysAvailable,
                             @Nullable
                             @Schema(description = "The next unclaimed one-time prekey; it is not claimed by this request")
                             NextPreKey nextPreKey) {
  }

  public record NextPreKey(long id, String publicKey) {
  }
}
