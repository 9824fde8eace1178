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
import org.whispersystems.keyserver.entities.MessageEnvelope;
import org.whispersystems.keyserver.entities.MessageListResponse;
import org.whispersystems.keyserver.entities.ReceiptResponse;
import org.whispersystems.keyserver.entities.SendMessageRequest;
import org.whispersystems.keyserver.entities.SendMessageResponse;
import org.whispersystems.keyserver.storage.MessagesManager;
import org.whispersystems.keyserver.storage.ThreadType;

@Path("/v1/messages")
@io.swagger.v3.oas.annotations.tags.Tag(name = "Messages")
public class MessagesController {

  private final MessagesManager messagesManager;

  public MessagesController(final MessagesManager messagesManager) {
    this.messagesManager = messagesManager;
  }

  @PUT
  @Path("/conversations/{conversationId}")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Send a message to a conversation")
  @ApiResponse(responseCode = "200", description = "The message was stored, or was a repeat of an earlier send.",
      useReturnTypeSchema = true)
  @ApiResponse(responseCode = "400", description = "The ciphertext is malformed or too large.")
  @ApiResponse(responseCode = "403", description = "The caller is not a participant, or the users block each other.")
  @ApiResponse(responseCode = "409", description = "The sending device is revoked.")
  @ApiResponse(responseCode = "429", description = "Rate limited; see Retry-After.")
  public SendMessageResponse sendDirect(@Auth final AuthenticatedUser auth,
      @PathParam("conversationId") final UUID conversationId,
      @NotNull @Valid final SendMessageRequest request) throws RateLimitExceededException {

    return SendMessageResponse.fromResult(messagesManager.sendDirect(auth.getUserId(), conversationId,
        request.deviceId(), request.ciphertext(), request.proto(), request.clientMessageId()));
  }

  @PUT
  @Path("/groups/{groupId}")
  @Consumes(MediaType.APPLICATION_JSON)
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Send a message to a group")
  @ApiResponse(responseCode = "409", description = """
      The sending device is revoked, or the message was encrypted for an old epoch; in the latter case the
      X-Current-Epoch header carries the current epoch.
      """)
  @ApiResponse(responseCode = "429", description = "Rate limited; see Retry-After.")
  public SendMessageResponse sendGroup(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @NotNull @Valid final SendMessageRequest request) throws RateLimitExceededException {

    if (request.groupEpoch() == null) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST, "groupEpoch is required for group messages");
    }

    return SendMessageResponse.fromResult(messagesManager.sendGroup(auth.getUserId(), groupId, request.deviceId(),
        request.ciphertext(), request.proto(), request.groupEpoch(), request.clientMessageId()));
  }

  @GET
  @Path("/conversations/{conversationId}")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Get conversation messages", description = "Returns a page of messages in chronological order.")
  public MessageListResponse getConversationMessages(@Auth final AuthenticatedUser auth,
      @PathParam("conversationId") final UUID conversationId,
      @QueryParam("limit") final Integer limit,
      @Parameter(description = "Return messages older than this message") @QueryParam("before") final UUID before,
      @Parameter(description = "Return messages newer than this message") @QueryParam("after") final UUID after) {

    return getMessages(auth, ThreadType.CONVERSATION, conversationId, limit, before, after);
  }

  @GET
  @Path("/groups/{groupId}")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Get group messages", description = "Returns a page of messages in chronological order.")
  public MessageListResponse getGroupMessages(@Auth final AuthenticatedUser auth,
      @PathParam("groupId") final UUID groupId,
      @QueryParam("limit") final Integer limit,
      @Parameter(description = "Return messages older than this message") @QueryParam("before") final UUID before,
      @Parameter(description = "Return messages newer than this message") @QueryParam("after") final UUID after) {

    return getMessages(auth, ThreadType.GROUP, groupId, limit, before, after);
  }

  @POST
  @Path("/{messageId}/delivered")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Mark a message delivered", description = "Only the first call sets the delivery time.")
  @ApiResponse(responseCode = "403", description = "The caller is not a recipient of the message.")
  public ReceiptResponse markDelivered(@Auth final AuthenticatedUser auth,
      @PathParam("messageId") final UUID messageId) {

    return ReceiptResponse.fromReceipt(messagesManager.markDelivered(auth.getUserId(), messageId));
  }

  @POST
  @Path("/{messageId}/read")
  @Produces(MediaType.APPLICATION_JSON)
  @Operation(summary = "Mark a message read", description = "Only the first call sets the read time.")
  @ApiResponse(responseCode = "403", description = "The caller is not a recipient of the message.")
  public ReceiptResponse markRead(@Auth final AuthenticatedUser auth, @PathParam("messageId") final UUID messageId) {
    return ReceiptResponse.fromReceipt(messagesManager.markRead(auth.getUserId(), messageId));
  }

  private MessageListResponse getMessages(final AuthenticatedUser auth, final ThreadType threadType,
      final UUID threadId, final Integer limit, final UUID before, final UUID after) {

    return new MessageListResponse(
        messagesManager.getMessages(auth.getUserId(), threadType, threadId, limit, before, after).stream()
            .map(MessageEnvelope::fromMessage)
            .toList());
  }
}
