/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.controllers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.glassfish.jersey.test.grizzly.GrizzlyWebTestContainerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.entities.ClaimPreKeyResponse;
import org.whispersystems.keyserver.entities.ErrorResponse;
import org.whispersystems.keyserver.entities.PreKeyBundleResponse;
import org.whispersystems.keyserver.entities.PreKeyStatusResponse;
import org.whispersystems.keyserver.entities.UploadKeyBundleRequest;
import org.whispersystems.keyserver.entities.UploadKeyBundleResponse;
import org.whispersystems.keyserver.mappers.KeyServerExceptionMapper;
import org.whispersystems.keyserver.storage.Device;
import org.whispersystems.keyserver.storage.DeviceStatus;
import org.whispersystems.keyserver.storage.KeyBundle;
import org.whispersystems.keyserver.storage.KeysManager;
import org.whispersystems.keyserver.storage.OneTimePreKey;
import org.whispersystems.keyserver.storage.PreKeyWatermark;
import org.whispersystems.keyserver.tests.util.AuthHelper;
import org.whispersystems.keyserver.util.SystemMapper;

@ExtendWith(DropwizardExtensionsSupport.class)
class KeysControllerTest {

  private static final UUID DEVICE_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private static final KeysManager keysManager = mock(KeysManager.class);

  private static final ResourceExtension resources = ResourceExtension.builder()
      .setMapper(SystemMapper.jsonMapper())
      .addProvider(AuthHelper.getAuthFilter())
      .addProvider(new AuthValueFactoryProvider.Binder<>(AuthenticatedUser.class))
      .setTestContainerFactory(new GrizzlyWebTestContainerFactory())
      .addResource(new KeyServerExceptionMapper())
      .addResource(new KeysController(keysManager))
      .build();

  @AfterEach
  void teardown() {
    reset(keysManager);
  }

  @Test
  void uploadKeyBundle() {
    when(keysManager.uploadKeyBundle(eq(AuthHelper.VALID_USER_ID), isNull(), eq("phone"), eq("aWRr"), eq("c3Br"),
        eq("c2ln"), eq(List.of("cGsx", "cGsy"))))
        .thenReturn(new KeysManager.UploadResult(DEVICE_ID, 1, 2));

    final UploadKeyBundleResponse response = resources.getJerseyTest()
        .target("/v1/keys")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .put(Entity.entity(new UploadKeyBundleRequest(null, "phone", "aWRr", "c3Br", "c2ln", List.of("cGsx", "cGsy")),
            MediaType.APPLICATION_JSON_TYPE), UploadKeyBundleResponse.class);

    assertThat(response).isEqualTo(new UploadKeyBundleResponse(DEVICE_ID, 1, 2));
  }

  @Test
  void uploadKeyBundleInvalidRequest() {
    try (final Response response = resources.getJerseyTest()
        .target("/v1/keys")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .put(Entity.entity(new UploadKeyBundleRequest(null, "", "aWRr", "c3Br", "c2ln", List.of("cGsx")),
            MediaType.APPLICATION_JSON_TYPE))) {

      assertThat(response.getStatus()).isEqualTo(422);
    }

    verifyNoInteractions(keysManager);
  }

  @Test
  void uploadKeyBundleIdentityChangeBlocked() {
    when(keysManager.uploadKeyBundle(anyLong(), any(), anyString(), anyString(), anyString(), anyString(), anyList()))
        .thenThrow(new KeyServerException(ErrorCode.IDENTITY_CHANGE_BLOCKED, "Too many identity key changes"));

    try (final Response response = resources.getJerseyTest()
        .target("/v1/keys")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .put(Entity.entity(new UploadKeyBundleRequest(DEVICE_ID, "phone", "aWRr", "c3Br", "c2ln", List.of("cGsx")),
            MediaType.APPLICATION_JSON_TYPE))) {

      assertThat(response.getStatus()).isEqualTo(409);
      assertThat(response.getHeaderString(KeyServerExceptionMapper.ERROR_CODE_HEADER))
          .isEqualTo("IDENTITY_CHANGE_BLOCKED");
      assertThat(response.readEntity(ErrorResponse.class).code()).isEqualTo("IDENTITY_CHANGE_BLOCKED");
    }
  }

  @Test
  void unauthenticated() {
    try (final Response response = resources.getJerseyTest()
        .target("/v1/keys/users/" + AuthHelper.VALID_USER_ID_TWO)
        .request()
        .get()) {

      assertThat(response.getStatus()).isEqualTo(401);
    }

    try (final Response response = resources.getJerseyTest()
        .target("/v1/keys/users/" + AuthHelper.VALID_USER_ID_TWO)
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.UNKNOWN_USER_ID))
        .get()) {

      assertThat(response.getStatus()).isEqualTo(401);
    }

    try (final Response response = resources.getJerseyTest()
        .target("/v1/keys/users/" + AuthHelper.VALID_USER_ID_TWO)
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID, "1:deadbeef"))
        .get()) {

      assertThat(response.getStatus()).isEqualTo(401);
    }

    verifyNoInteractions(keysManager);
  }

  @Test
  void getKeyBundles() {
    final Device device = new Device(DEVICE_ID, AuthHelper.VALID_USER_ID_TWO, "laptop", DeviceStatus.ACTIVE, NOW, NOW);
    final KeyBundle bundle = new KeyBundle(DEVICE_ID, "aWRr", "c3Br", "c2ln", 4, 3, NOW);

    when(keysManager.getKeyBundles(AuthHelper.VALID_USER_ID, AuthHelper.VALID_USER_ID_TWO, null))
        .thenReturn(List.of(new KeysManager.DevicePreKeys(device, bundle, 3,
            Optional.of(new OneTimePreKey(17, DEVICE_ID, "cGsx", false)))));

    final PreKeyBundleResponse response = resources.getJerseyTest()
        .target("/v1/keys/users/" + AuthHelper.VALID_USER_ID_TWO)
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .get(PreKeyBundleResponse.class);

    assertThat(response.userId()).isEqualTo(AuthHelper.VALID_USER_ID_TWO);
    assertThat(response.devices()).singleElement().satisfies(deviceBundle -> {
      assertThat(deviceBundle.deviceId()).isEqualTo(DEVICE_ID);
      assertThat(deviceBundle.bundleVersion()).isEqualTo(4);
      assertThat(deviceBundle.prekeysAvailable()).isEqualTo(3);
      assertThat(deviceBundle.nextPreKey()).isEqualTo(new PreKeyBundleResponse.NextPreKey(17, "cGsx"));
    });
  }

  @Test
  void getKeyBundlesStale() {
    when(keysManager.getKeyBundles(AuthHelper.VALID_USER_ID, AuthHelper.VALID_USER_ID_TWO, 2L))
        .thenThrow(KeyServerException.bundleStale(3));

    try (final Response response = resources.getJerseyTest()
        .target("/v1/keys/users/" + AuthHelper.VALID_USER_ID_TWO)
        .queryParam("knownVersion", 2)
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .get()) {

      assertThat(response.getStatus()).isEqualTo(409);
      assertThat(response.getHeaderString(KeyServerException.BUNDLE_VERSION_HEADER)).isEqualTo("3");
      assertThat(response.getHeaderString(KeyServerExceptionMapper.ERROR_CODE_HEADER)).isEqualTo("BUNDLE_STALE");
    }
  }

  @Test
  void claimPreKey() {
    when(keysManager.claimPreKey(AuthHelper.VALID_USER_ID, DEVICE_ID, 17))
        .thenReturn(new KeysManager.ClaimedPreKey(DEVICE_ID, 17, "cGsx", 2));

    final ClaimPreKeyResponse response = resources.getJerseyTest()
        .target("/v1/keys/devices/" + DEVICE_ID + "/prekeys/17/claim")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .post(Entity.json(""), ClaimPreKeyResponse.class);

    assertThat(response).isEqualTo(new ClaimPreKeyResponse(DEVICE_ID, 17, "cGsx", 2));
  }

  @Test
  void claimPreKeyNotFound() {
    when(keysManager.claimPreKey(AuthHelper.VALID_USER_ID, DEVICE_ID, 17))
        .thenThrow(new KeyServerException(ErrorCode.PREKEY_NOT_FOUND, "Prekey not found"));

    try (final Response response = resources.getJerseyTest()
        .target("/v1/keys/devices/" + DEVICE_ID + "/prekeys/17/claim")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .post(Entity.json(""))) {

      assertThat(response.getStatus()).isEqualTo(404);
      assertThat(response.getHeaderString(KeyServerExceptionMapper.ERROR_CODE_HEADER)).isEqualTo("PREKEY_NOT_FOUND");
    }
  }

  @Test
  void getPreKeyStatus() {
    when(keysManager.getPreKeyStatus(AuthHelper.VALID_USER_ID, DEVICE_ID))
        .thenReturn(new KeysManager.PreKeyStatus(DEVICE_ID, 3, 100, PreKeyWatermark.LOW,
            Optional.of(Duration.ofDays(8)), true));

    final PreKeyStatusResponse response = resources.getJerseyTest()
        .target("/v1/keys/devices/" + DEVICE_ID + "/status")
        .request()
        .header("Authorization", AuthHelper.getAuthHeader(AuthHelper.VALID_USER_ID))
        .get(PreKeyStatusResponse.class);

    assertThat(response).isEqualTo(
        new PreKeyStatusResponse(DEVICE_ID, 3, 100, "low", Duration.ofDays(8).toSeconds(), true));
    verify(keysManager).getPreKeyStatus(AuthHelper.VALID_USER_ID, DEVICE_ID);
  }
}
