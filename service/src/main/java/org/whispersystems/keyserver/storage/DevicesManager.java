/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Metrics;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.controllers.ErrorCode;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.util.Constants;

/**
 * The device trust lifecycle: listing, revocation, and checks that a device may still act for its owner.
 */
public class DevicesManager {

  private static final Logger auditLogger = LoggerFactory.getLogger(Constants.AUDIT_LOGGER_NAME);

  private static final String REVOKE_COUNTER_NAME = name(DevicesManager.class, "revoke");
  private static final String REVOKED_DEVICE_USE_COUNTER_NAME = name(DevicesManager.class, "revokedDeviceUse");

  private final FaultTolerantDatabase database;
  private final Devices devices;
  private final Clock clock;

  public DevicesManager(final FaultTolerantDatabase database, final Devices devices, final Clock clock) {
    this.database = database;
    this.devices = devices;
    this.clock = clock;
  }

  public List<Device> getDevices(final long callerId) {
    return devices.getByOwner(callerId);
  }

  /**
   * Revokes one of the caller's devices.
   *
   * @return true if the device was revoked by this call, false if it had already been revoked
   */
  public boolean revokeDevice(final long callerId, final UUID deviceId, @Nullable final String reason) {
    final boolean revoked = database.inTransaction(handle -> {
      final Device device = devices.getForUpdate(handle, deviceId)
          .filter(d -> d.isOwnedBy(callerId))
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Device not found"));

      return devices.revoke(handle, device, reason, clock.instant());
    });

    if (revoked) {
      auditLogger.warn("Device {} of user {} revoked by owner (reason: {})", deviceId, callerId, reason);
    }

    Metrics.counter(REVOKE_COUNTER_NAME, "alreadyRevoked", String.valueOf(!revoked)).increment();

    return revoked;
  }

  /**
   * Returns the device if it belongs to the caller and is still active.
   *
   * @throws KeyServerException {@code FORBIDDEN} if the device is not the caller's, {@code DEVICE_REVOKED} if it has
   * been revoked
   */
  public Device getActingDevice(final long callerId, final UUID deviceId) {
    final Device device = devices.get(deviceId)
        .filter(d -> d.isOwnedBy(callerId))
        .orElseThrow(() -> new KeyServerException(ErrorCode.FORBIDDEN, "Device is not owned by caller"));

    if (!device.isActive()) {
      throw revokedDeviceUse(device, Response.Status.CONFLICT);
    }

    return device;
  }

  static KeyServerException revokedDeviceUse(final Device device, final Response.Status status) {
    auditLogger.warn("Attempted use of revoked device {} of user {}", device.id(), device.ownerUserId());
    Metrics.counter(REVOKED_DEVICE_USE_COUNTER_NAME).increment();

    return new KeyServerException(ErrorCode.DEVICE_REVOKED, status, "Device has been revoked");
  }
}
