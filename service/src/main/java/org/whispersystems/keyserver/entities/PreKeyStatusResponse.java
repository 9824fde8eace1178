/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.UUID;
import javax.annotation.Nullable;

public record PreKeyStatusResponse(UUID deviceId,
                                   int available,
                                   int poolSize,
                                   @Schema(description = "ok, low or critical") String watermark,
                                   @Nullable Long signedPreKeyAgeSeconds,
                                   boolean rotationDue) {
}
