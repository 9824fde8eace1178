/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import jakarta.validation.constraints.Size;
import javax.annotation.Nullable;

public record RevokeDeviceRequest(@Nullable @Size(max = 256) String reason) {
}
