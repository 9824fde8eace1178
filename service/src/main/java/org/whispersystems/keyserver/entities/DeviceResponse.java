/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.time.Instant;
import java.util.UUID;
import javax.annotation.Nullable;
import org.whispersystems.keyserver.storage.Device;

public record DeviceResponse(UUID id, String name, String status, Instant createdAt, @Nullable Instant lastSeenAt) {

  public static DeviceResponse fromDevice(final Device device) {
    return new DeviceResponse(device.id(), device.name(), device.status().name().toLowerCase(), device.createdAt(),
        device.lastSeenAt());
  }
}
