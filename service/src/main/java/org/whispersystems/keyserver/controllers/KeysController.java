/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.controllers;

import io.dropwizard.auth.Auth;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.UUID;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.entities.ClaimPreKeyResponse;
import org.whispersystems.keyserver.entities.PreKeyBundleResponse;
import org.whispersystems.keyserver.entities.PreKeyStatusResponse;
import org.whispersystems.keyserver.entities.UploadKeyBundleRequest;
import org.whispersystems.keyserver.entities.UploadKeyBundleResponse;
import org.whispersystems.keyserver.storage.KeysManager;

@Path("/v1/keys")
@io.swagger.v3.oas.annotations.tags.Tag(name = "Keys")
public class KeysController {

  private final KeysManager keysManager;

  public KeysController(final KeysManager keysManager) {
    this.keysManager = keysManager;
  }

  @PUT
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Upload a key bundle",
      description = """
          Creates or replaces the key bundle of one of the caller's devices, registering a new device if no device id
          is given. Replaces all of the device's unclaimed one-time prekeys.
          """)
  @ApiResponse(responseCode = "200", description = "The bundle was stored.", useReturnTypeSchema = true)
  @ApiResponse(responseCode = "400", description = "The prekey list is empty, too long, or holds malformed keys.")
  @ApiResponse(responseCode = "403", description = "The device belongs to another user or has been revoked.")
  @ApiResponse(responseCode = "409", description = "Too many identity key changes; the device has been revoked.")
  public UploadKeyBundleResponse uploadKeyBundle(@Auth final AuthenticatedUser auth,
      @NotNull @Valid final UploadKeyBundleRequest request) {

    final KeysManager.UploadResult result = keysManager.uploadKeyBundle(auth.getUserId(), request.deviceId(),
        request.name(), request.identityKey(), request.signedPreKey(), request.signedPreKeySignature(),
        request.preKeys());

    return new UploadKeyBundleResponse(result.deviceId(), result.bundleVersion(), result.prekeysStored());
  }

  @GET
  @Path("/users/{userId}")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Fetch key bundles",
      description = "Returns the key bundle of each of the target user's active devices.")
  @ApiResponse(responseCode = "200", description = "The target's bundles.", useReturnTypeSchema = true)
  @ApiResponse(responseCode = "403", description = "The users block each other or share no conversation or group.")
  @ApiResponse(responseCode = "404", description = "The target user does not exist.")
  @ApiResponse(responseCode = "409", description = """
      A device has a newer bundle than knownVersion; the X-Bundle-Version header carries the current version.
      """)
  public PreKeyBundleResponse getKeyBundles(@Auth final AuthenticatedUser auth,
      @PathParam("userId") final long userId,
      @Parameter(description = "The newest bundle version the caller already holds")
      @QueryParam("knownVersion") final Long knownVersion) {

    return new PreKeyBundleResponse(userId, keysManager.getKeyBundles(auth.getUserId(), userId, knownVersion).stream()
        .map(devicePreKeys -> new PreKeyBundleResponse.DeviceBundle(devicePreKeys.device().id(),
            devicePreKeys.device().name(),
            devicePreKeys.bundle().identityKey(),
            devicePreKeys.bundle().signedPreKey(),
            devicePreKeys.bundle().signedPreKeySignature(),
            devicePreKeys.bundle().bundleVersion(),
            devicePreKeys.prekeysAvailable(),
            devicePreKeys.nextPreKey()
                .map(preKey -> new PreKeyBundleResponse.NextPreKey(preKey.id(), preKey.publicKey()))
                .orElse(null)))
        .toList());
  }

  @POST
  @Path("/devices/{deviceId}/prekeys/{prekeyId}/claim")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Claim a one-time prekey",
      description = "Atomically claims one unclaimed one-time prekey of the device. Each prekey can be claimed once.")
  @ApiResponse(responseCode = "200", description = "The prekey was claimed.", useReturnTypeSchema = true)
  @ApiResponse(responseCode = "403", description = "The users block each other or share no conversation or group.")
  @ApiResponse(responseCode = "404", description = "The device or prekey does not exist, or the prekey was already claimed.")
  @ApiResponse(responseCode = "409", description = "The device is revoked or has no unclaimed prekeys left.")
  public ClaimPreKeyResponse claimPreKey(@Auth final AuthenticatedUser auth,
      @PathParam("deviceId") final UUID deviceId,
      @PathParam("prekeyId") final long prekeyId) {

    final KeysManager.ClaimedPreKey claimed = keysManager.claimPreKey(auth.getUserId(), deviceId, prekeyId);
    return new ClaimPreKeyResponse(claimed.deviceId(), claimed.prekeyId(), claimed.publicKey(),
        claimed.prekeysRemaining());
  }

  @GET
  @Path("/devices/{deviceId}/status")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Get prekey pool status", description = "Reports pool health for one of the caller's devices.")
  @ApiResponse(responseCode = "200", description = "The pool status.", useReturnTypeSchema = true)
  @ApiResponse(responseCode = "404", description = "The caller has no such device.")
  public PreKeyStatusResponse getPreKeyStatus(@Auth final AuthenticatedUser auth,
      @PathParam("deviceId") final UUID deviceId) {

    final KeysManager.PreKeyStatus status = keysManager.getPreKeyStatus(auth.getUserId(), deviceId);
    return new PreKeyStatusResponse(status.deviceId(), status.available(), status.poolSize(),
        status.watermark().name().toLowerCase(), status.signedPreKeyAge().map(age -> age.toSeconds()).orElse(null),
        status.rotationDue());
  }
}
