/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.controllers;

import io.dropwizard.auth.Auth;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.UUID;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.entities.DeviceListResponse;
import org.whispersystems.keyserver.entities.DeviceResponse;
import org.whispersystems.keyserver.entities.RevokeDeviceRequest;
import org.whispersystems.keyserver.entities.RevokeDeviceResponse;
import org.whispersystems.keyserver.storage.DevicesManager;

@Path("/v1/devices")
@io.swagger.v3.oas.annotations.tags.Tag(name = "Devices")
public class DevicesController {

  private final DevicesManager devicesManager;

  public DevicesController(final DevicesManager devicesManager) {
    this.devicesManager = devicesManager;
  }

  @GET
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "List devices", description = "Lists all of the caller's devices, including revoked ones.")
  public DeviceListResponse getDevices(@Auth final AuthenticatedUser auth) {
    return new DeviceListResponse(devicesManager.getDevices(auth.getUserId()).stream()
        .map(DeviceResponse::fromDevice)
        .toList());
  }

  @POST
  @Path("/{deviceId}/revoke")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Revoke a device",
      description = "Permanently revokes one of the caller's devices. Revoking a revoked device succeeds and changes nothing.")
  @ApiResponse(responseCode = "200", description = "The device is revoked.", useReturnTypeSchema = true)
  @ApiResponse(responseCode = "404", description = "The caller has no such device.")
  public RevokeDeviceResponse revokeDevice(@Auth final AuthenticatedUser auth,
      @PathParam("deviceId") final UUID deviceId,
      @Valid final RevokeDeviceRequest request) {

    return new RevokeDeviceResponse(deviceId,
        devicesManager.revokeDevice(auth.getUserId(), deviceId, request != null ? request.reason() : null));
  }
}
