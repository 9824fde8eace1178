/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.controllers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.when;

import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.glassfish.jersey.test.grizzly.GrizzlyWebTestContainerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.entities.DeviceListResponse;
import org.whispersystems.keyserver.entities.DeviceResponse;
import org.whispersystems.keyserver.entities.RevokeDeviceRequest;
import org.whispersystems.keyserver.entities.RevokeDeviceResponse;
import org.whispersystems.keyserver.mappers.KeyServerExceptionMapper;
import org.whispersystems.keyserver.storage.Device;
import org.whispersystems.keyserver.storage.DeviceStatus;
import org.whispersystems.keyserver.storage.DevicesManager;
import org.whispersystems.keyserver.tests.util.AuthHelper;
import org.whispersystems.keyserver.util.SystemMapper;

@ExtendWith(DropwizardExtensionsSupport.class)
class DevicesControllerTest {

  private static final UUID DEVICE_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private static final DevicesManager devicesManager = mock(DevicesManager.class);

  private static final ResourceExtension resources = ResourceExtension.builder()
      .setMapper(SystemMapper.jsonMapper())
      .addProvider(AuthHelper.getAuthFilter())
      .addProvider(new AuthValueFactoryProvider.Binder<>(AuthenticatedUser.class))
      .setTestContainerFactory(new GrizzlyWebTestContainerFactory())
      .addResource(new KeyServerExceptionMapper())
      .addResource(new DevicesController(devicesManager))
      .build();

  @AfterEach
  void teardown() {
    reset(devicesManager);
  }

  @Test
  void getDevices() {
    when(devicesManager.getDevices(AuthHelper.VALID_USER_ID)).thenReturn(List.of(
        new Device(DEVICE_ID, AuthHelper.VALID_USER_ID, "laptop", DeviceStatus.REVOKED, NOW, null)));

    final DeviceListResponse response = resources.getJerseyTest()
        .target("/v1/devices")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .get(DeviceListResponse.class);

    assertThat(response.devices()).containsExactly(new DeviceResponse(DEVICE_ID, "laptop", "revoked", NOW, null));
  }

  @Test
  void revokeDevice() {
    when(devicesManager.revokeDevice(AuthHelper.VALID_USER_ID, DEVICE_ID, "lost")).thenReturn(true);

    final RevokeDeviceResponse response = resources.getJerseyTest()
        .target("/v1/devices/" + DEVICE_ID + "/revoke")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .post(Entity.json(new RevokeDeviceRequest("lost")), RevokeDeviceResponse.class);

    assertThat(response).isEqualTo(new RevokeDeviceResponse(DEVICE_ID, true));
  }

  @Test
  void revokeDeviceNotOwned() {
    when(devicesManager.revokeDevice(AuthHelper.VALID_USER_ID_TWO, DEVICE_ID, null))
        .thenThrow(new KeyServerException(ErrorCode.NOT_FOUND, "Device not found"));

    try (final Response response = resources.getJerseyTest()
        .target("/v1/devices/" + DEVICE_ID + "/revoke")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID_TWO))
        .post(Entity.json(new RevokeDeviceRequest(null)))) {

      assertThat(response.getStatus()).isEqualTo(404);
      assertThat(response.getHeaderString(KeyServerExceptionMapper.ERROR_CODE_HEADER)).isEqualTo("NOT_FOUND");
    }
  }
}
