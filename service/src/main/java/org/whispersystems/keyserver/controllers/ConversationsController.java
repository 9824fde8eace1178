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
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.UUID;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.entities.ConversationListResponse;
import org.whispersystems.keyserver.entities.ConversationResponse;
import org.whispersystems.keyserver.entities.CreateConversationRequest;
import org.whispersystems.keyserver.storage.ConversationsManager;

@Path("/v1/conversations")
@io.swagger.v3.oas.annotations.tags.Tag(name = "Conversations")
public class ConversationsController {

  private final ConversationsManager conversationsManager;

  public ConversationsController(final ConversationsManager conversationsManager) {
    this.conversationsManager = conversationsManager;
  }

  @POST
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Open a conversation",
      description = "Returns the caller's one-to-one conversation with the peer, creating it if it does not exist.")
  @ApiResponse(responseCode = "200", description = "The conversation.", useReturnTypeSchema = true)
  @ApiResponse(responseCode = "400", description = "The peer is the caller.")
  @ApiResponse(responseCode = "403", description = "The users block each other.")
  @ApiResponse(responseCode = "404", description = "The peer does not exist.")
  public ConversationResponse findOrCreate(@Auth final AuthenticatedUser auth,
      @NotNull @Valid final CreateConversationRequest request) {

    return ConversationResponse.fromView(conversationsManager.findOrCreate(auth.getUserId(), request.peerUserId()));
  }

  @GET
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "List conversations", description = "Lists the caller's conversations, most recently active first.")
  public ConversationListResponse listConversations(@Auth final AuthenticatedUser auth,
      @QueryParam("limit") @DefaultValue("50") @Min(1) @Max(200) final int limit,
      @QueryParam("offset") @DefaultValue("0") @Min(0) final int offset) {

    return new ConversationListResponse(conversationsManager.listConversations(auth.getUserId(), limit, offset).stream()
        .map(summary -> new ConversationListResponse.Summary(summary.conversation().id(),
            summary.peerUserId(),
            summary.conversation().createdAt(),
            summary.conversation().lastMessageAt(),
            summary.unreadCount()))
        .toList());
  }

  @GET
  @Path("/{conversationId}")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Get a conversation")
  @ApiResponse(responseCode = "404", description = "No such conversation, or the caller does not participate in it.")
  public ConversationResponse getConversation(@Auth final AuthenticatedUser auth,
      @PathParam("conversationId") final UUID conversationId) {

    return ConversationResponse.fromView(conversationsManager.getConversation(auth.getUserId(), conversationId));
  }
}
