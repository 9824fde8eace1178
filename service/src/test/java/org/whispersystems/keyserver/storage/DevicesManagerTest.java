/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.whispersystems.keyserver.storage.KeysManagerTest.assertError;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.whispersystems.keyserver.controllers.ErrorCode;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.util.TestClock;

class DevicesManagerTest {

  @RegisterExtension
  final H2DatabaseExtension DATABASE = new H2DatabaseExtension();

  private static final long ALICE = 1;
  private static final long BOB = 2;

  private final TestClock clock = TestClock.pinned(Instant.parse("2024-03-01T12:00:00Z"));

  private Devices devices;
  private DevicesManager devicesManager;

  @BeforeEach
  void setUp() {
    DATABASE.createUser(ALICE);
    DATABASE.createUser(BOB);

    devices = new Devices(DATABASE.getDatabase());
    devicesManager = new DevicesManager(DATABASE.getDatabase(), devices, clock);
  }

  @Test
  void revokeIsIdempotentAndRecorded() {
    final UUID deviceId = createDevice(ALICE);

    assertThat(devicesManager.revokeDevice(ALICE, deviceId, "lost")).isTrue();
    assertThat(devicesManager.revokeDevice(ALICE, deviceId, "lost again")).isFalse();

    assertThat(devices.get(deviceId)).hasValueSatisfying(
        device -> assertThat(device.status()).isEqualTo(DeviceStatus.REVOKED));

    final List<String> revocationReasons = DATABASE.getJdbi().withHandle(handle ->
        handle.createQuery("SELECT reason FROM device_revocations WHERE device_id = :device_id")
            .bind("device_id", deviceId)
            .mapTo(String.class)
            .list());

    assertThat(revocationReasons).containsExactly("lost");
  }

  @Test
  void revokeRequiresOwnership() {
    final UUID deviceId = createDevice(ALICE);

    assertError(() -> devicesManager.revokeDevice(BOB, deviceId, null), ErrorCode.NOT_FOUND);
    assertError(() -> devicesManager.revokeDevice(ALICE, UUID.randomUUID(), null), ErrorCode.NOT_FOUND);

    assertThat(devicesManager.getActingDevice(ALICE, deviceId).isActive()).isTrue();
  }

  @Test
  void actingDevice() {
    final UUID deviceId = createDevice(ALICE);

    assertError(() -> devicesManager.getActingDevice(BOB, deviceId), ErrorCode.FORBIDDEN);
    assertError(() -> devicesManager.getActingDevice(ALICE, UUID.randomUUID()), ErrorCode.FORBIDDEN);

    devicesManager.revokeDevice(ALICE, deviceId, null);

    assertThatThrownBy(() -> devicesManager.getActingDevice(ALICE, deviceId))
        .isInstanceOfSatisfying(KeyServerException.class, e -> {
          assertThat(e.getCode()).isEqualTo(ErrorCode.DEVICE_REVOKED);
          assertThat(e.getStatus().getStatusCode()).isEqualTo(409);
        });
  }

  @Test
  void listIncludesRevokedDevices() {
    final UUID active = createDevice(ALICE);
    final UUID revoked = createDevice(ALICE);
    createDevice(BOB);

    devicesManager.revokeDevice(ALICE, revoked, null);

    assertThat(devicesManager.getDevices(ALICE))
        .extracting(Device::id, Device::status)
        .containsExactlyInAnyOrder(
            tuple(active, DeviceStatus.ACTIVE),
            tuple(revoked, DeviceStatus.REVOKED));
  }

  private UUID createDevice(final long userId) {
    final UUID deviceId = UUID.randomUUID();

    DATABASE.getDatabase().useTransaction(handle ->
        devices.create(handle, new Device(deviceId, userId, "phone", DeviceStatus.ACTIVE, clock.instant(), null)));

    return deviceId;
  }
}
