/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.controllers;

import io.dropwizard.auth.Auth;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.UUID;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.entities.AddMembersRequest;
import org.whispersystems.keyserver.entities.AddMembersResponse;
import org.whispersystems.keyserver.entities.BanUserRequest;
import org.whispersystems.keyserver.entities.CreateGroupRequest;
import org.whispersystems.keyserver.entities.EpochResponse;
import org.whispersystems.keyserver.entities.GroupListResponse;
import org.whispersystems.keyserver.entities.GroupMembersResponse;
import org.whispersystems.keyserver.entities.GroupResponse;
import org.whispersystems.keyserver.entities.MuteGroupRequest;
import org.whispersystems.keyserver.entities.SenderKeyListResponse;
import org.whispersystems.keyserver.entities.SenderKeyRequest;
import org.whispersystems.keyserver.entities.SenderKeyResponse;
import org.whispersystems.keyserver.entities.TargetUserRequest;
import org.whispersystems.keyserver.storage.Group;
import org.whispersystems.keyserver.storage.GroupsManager;

@Path("/v1/groups")
@io.swagger.v3.oas.annotations.tags.Tag(name = "Groups")
public class GroupsController {

  private final GroupsManager groupsManager;

  public GroupsController(final GroupsManager groupsManager) {
    this.groupsManager = groupsManager;
  }

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Create a group", description = "Creates a group owned by the caller, at epoch 0.")
  public GroupResponse createGroup(@Auth final AuthenticatedUser auth,
      @NotNull @Valid final CreateGroupRequest request) {

    return GroupResponse.fromGroup(groupsManager.createGroup(auth.getUserId(), request.title(), request.about()));
  }

  @GET
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "List groups", description = "Lists the groups the caller is an active member of.")
  public GroupListResponse listGroups(@Auth final AuthenticatedUser auth,
      @QueryParam("limit") @DefaultValue("50") @Min(1) @Max(200) final int limit,
      @QueryParam("offset") @DefaultValue("0") @Min(0) final int offset) {

    return new GroupListResponse(groupsManager.listGroups(auth.getUserId(), limit, offset).stream()
        .map(GroupResponse::fromGroup)
        .toList());
  }

  @GET
  @Path("/{groupId}")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Get a group")
  @ApiResponse(responseCode = "403", description = "The caller is not a member.")
  @ApiResponse(responseCode = "404", description = "No such group.")
  public GroupResponse getGroup(@Auth final AuthenticatedUser auth, @PathParam("groupId") final UUID groupId) {
    return GroupResponse.fromGroup(groupsManager.getGroup(auth.getUserId(), groupId));
  }

  @PUT
  @Path("/{groupId}")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Update group details", description = "Changes the title and description. Owner or admin only.")
  public GroupResponse updateGroup(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @NotNull @Valid final CreateGroupRequest request) {

    return GroupResponse.fromGroup(
        groupsManager.updateGroup(auth.getUserId(), groupId, request.title(), request.about()));
  }

  @POST
  @Path("/{groupId}/close")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Close a group", description = "Permanently closes the group. Owner only.")
  public GroupResponse closeGroup(@Auth final AuthenticatedUser auth, @PathParam("groupId") final UUID groupId) {
    return GroupResponse.fromGroup(groupsManager.closeGroup(auth.getUserId(), groupId));
  }

  @GET
  @Path("/{groupId}/members")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "List members")
  public GroupMembersResponse listMembers(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId) {

    return new GroupMembersResponse(groupsManager.listMembers(auth.getUserId(), groupId).stream()
        .map(participant -> new GroupMembersResponse.Member(participant.userId(),
            participant.role().name().toLowerCase(),
            participant.joinedAt(),
            participant.muteUntil()))
        .toList());
  }

  @POST
  @Path("/{groupId}/members")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Add members",
      description = """
          Adds users to the group, skipping unknown, banned and existing members. Advances the epoch once if anyone
          was added. Owner or admin only.
          """)
  @ApiResponse(responseCode = "409", description = "The group does not have room for the new members.")
  public AddMembersResponse addMembers(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @NotNull @Valid final AddMembersRequest request) {

    final GroupsManager.AddMembersResult result =
        groupsManager.addMembers(auth.getUserId(), groupId, request.userIds());

    return new AddMembersResponse(result.addedUserIds(), result.epoch());
  }

  @DELETE
  @Path("/{groupId}/members/{userId}")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Remove a member", description = "Removes a member and advances the epoch. Owner or admin only.")
  public EpochResponse removeMember(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @PathParam("userId") final long userId) {

    return new EpochResponse(groupId, groupsManager.removeMember(auth.getUserId(), groupId, userId));
  }

  @POST
  @Path("/{groupId}/leave")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Leave a group", description = "Removes the caller and advances the epoch.")
  public EpochResponse leaveGroup(@Auth final AuthenticatedUser auth, @PathParam("groupId") final UUID groupId) {
    return new EpochResponse(groupId, groupsManager.leaveGroup(auth.getUserId(), groupId));
  }

  @POST
  @Path("/{groupId}/promote")
  @Consumes(MediaType.APPLICATION_JSON)
  @Operation(summary = "Promote a member to admin")
  public Response promoteMember(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @NotNull @Valid final TargetUserRequest request) {

    groupsManager.promoteMember(auth.getUserId(), groupId, request.userId());
    return Response.noContent().build();
  }

  @POST
  @Path("/{groupId}/demote")
  @Consumes(MediaType.APPLICATION_JSON)
  @Operation(summary = "Demote an admin to member", description = "Owner only.")
  public Response demoteAdmin(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @NotNull @Valid final TargetUserRequest request) {

    groupsManager.demoteAdmin(auth.getUserId(), groupId, request.userId());
    return Response.noContent().build();
  }

  @POST
  @Path("/{groupId}/owner")
  @Consumes(MediaType.APPLICATION_JSON)
  @Operation(summary = "Transfer ownership", description = "Makes another member the owner. The caller becomes an admin.")
  public Response transferOwnership(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @NotNull @Valid final TargetUserRequest request) {

    groupsManager.transferOwnership(auth.getUserId(), groupId, request.userId());
    return Response.noContent().build();
  }

  @POST
  @Path("/{groupId}/bans")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Ban a user", description = "Bans the user and advances the epoch. Owner or admin only.")
  public EpochResponse banUser(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @NotNull @Valid final BanUserRequest request) {

    return new EpochResponse(groupId,
        groupsManager.banUser(auth.getUserId(), groupId, request.userId(), request.reason()));
  }

  @DELETE
  @Path("/{groupId}/bans/{userId}")
  @Operation(summary = "Lift a ban",
      description = "Lifts a ban without re-admitting the user. The epoch does not change. Owner or admin only.")
  public Response unbanUser(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @PathParam("userId") final long userId) {

    groupsManager.unbanUser(auth.getUserId(), groupId, userId);
    return Response.noContent().build();
  }

  @PUT
  @Path("/{groupId}/mute")
  @Consumes(MediaType.APPLICATION_JSON)
  @Operation(summary = "Mute or unmute a group for the caller")
  public Response muteGroup(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @NotNull @Valid final MuteGroupRequest request) {

    groupsManager.muteGroup(auth.getUserId(), groupId, request.muteUntil());
    return Response.noContent().build();
  }

  @PUT
  @Path("/{groupId}/sender-keys")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Record sender-key rotation",
      description = "Stores opaque metadata about the sender key one of the caller's devices uses in the current epoch.")
  @ApiResponse(responseCode = "409", description = """
      The epoch is not current; the X-Current-Epoch header carries the current epoch.
      """)
  public SenderKeyResponse recordSenderKey(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @NotNull @Valid final SenderKeyRequest request) {

    return SenderKeyResponse.fromRecord(groupsManager.recordSenderKey(auth.getUserId(), groupId, request.deviceId(),
        request.senderKeyId(), request.chainIndex(), request.groupEpoch()));
  }

  @GET
  @Path("/{groupId}/sender-keys")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "List sender keys", description = "Lists sender-key metadata recorded for the current epoch.")
  public SenderKeyListResponse listSenderKeys(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId) {

    final Group group = groupsManager.getGroup(auth.getUserId(), groupId);

    return new SenderKeyListResponse(group.epoch(), groupsManager.listSenderKeys(auth.getUserId(), groupId).stream()
        .map(SenderKeyResponse::fromRecord)
        .toList());
  }
}
