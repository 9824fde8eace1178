/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.controllers;

import io.dropwizard.auth.Auth;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.UUID;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.entities.CreateInviteRequest;
import org.whispersystems.keyserver.entities.InviteListResponse;
import org.whispersystems.keyserver.entities.InviteResponse;
import org.whispersystems.keyserver.entities.JoinGroupRequest;
import org.whispersystems.keyserver.entities.JoinGroupResponse;
import org.whispersystems.keyserver.storage.GroupInvitesManager;

@Path("/v1/invites")
@io.swagger.v3.oas.annotations.tags.Tag(name = "Groups")
public class GroupInvitesController {

  private final GroupInvitesManager groupInvitesManager;

  public GroupInvitesController(final GroupInvitesManager groupInvitesManager) {
    this.groupInvitesManager = groupInvitesManager;
  }

  @POST
  @Path("/groups/{groupId}")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Create an invite", description = "Creates a link or direct invite. Owner or admin only.")
  @ApiResponse(responseCode = "400", description = "A direct invite has no target, or the expiry is in the past.")
  @ApiResponse(responseCode = "409", description = "No unique code could be generated.")
  public InviteResponse createInvite(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @NotNull @Valid final CreateInviteRequest request) {

    return InviteResponse.fromInvite(groupInvitesManager.createInvite(auth.getUserId(), groupId, request.type(),
        request.targetUserId(), request.expiresAt(), request.maxUses()));
  }

  @GET
  @Path("/groups/{groupId}")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "List active invites", description = "Owner or admin only.")
  public InviteListResponse listInvites(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId) {

    return new InviteListResponse(groupInvitesManager.listInvites(auth.getUserId(), groupId).stream()
        .map(InviteResponse::fromInvite)
        .toList());
  }

  @DELETE
  @Path("/groups/{groupId}/{inviteId}")
  @Operation(summary = "Revoke an invite", description = "Owner or admin only.")
  public Response revokeInvite(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @PathParam("inviteId") final UUID inviteId) {

    groupInvitesManager.revokeInvite(auth.getUserId(), groupId, inviteId);
    return Response.noContent().build();
  }

  @POST
  @Path("/join")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Join a group with an invite code",
      description = "Admits the caller and advances the epoch. Callers who are already members succeed without change.")
  @ApiResponse(responseCode = "403", description = "The caller is banned, or the invite is for another user.")
  @ApiResponse(responseCode = "409", description = "The invite is used up or the group is full.")
  @ApiResponse(responseCode = "410", description = "The invite has expired.")
  public JoinGroupResponse joinByCode(@Auth final AuthenticatedUser auth,
      @NotNull @Valid final JoinGroupRequest request) {

    final GroupInvitesManager.JoinResult result = groupInvitesManager.joinByCode(auth.getUserId(), request.code());
    return new JoinGroupResponse(result.groupId(), result.epoch(), result.joined());
  }
}
