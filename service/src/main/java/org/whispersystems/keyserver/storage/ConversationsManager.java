/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.controllers.ErrorCode;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.identity.RelationshipDirectory;
import org.whispersystems.keyserver.util.PairKeys;

/**
 * One-to-one conversations. There is at most one conversation per unordered pair of users; concurrent attempts to
 * create the same conversation converge on the first row committed.
 */
public class ConversationsManager {

  private static final Logger logger = LoggerFactory.getLogger(ConversationsManager.class);

  private static final String FIND_OR_CREATE_COUNTER_NAME = name(ConversationsManager.class, "findOrCreate");

  private static final int MAX_CREATE_ATTEMPTS = 3;

  private final FaultTolerantDatabase database;
  private final Conversations conversations;
  private final Devices devices;
  private final RelationshipDirectory relationshipDirectory;
  private final Clock clock;

  public record ConversationView(Conversation conversation, List<ConversationParticipant> participants,
                                 boolean created) {

    public boolean hasParticipant(final long userId) {
      return participants.stream().anyMatch(participant -> participant.userId() == userId);
    }
  }

  public ConversationsManager(final FaultTolerantDatabase database,
      final Conversations conversations,
      final Devices devices,
      final RelationshipDirectory relationshipDirectory,
      final Clock clock) {

    this.database = database;
    this.conversations = conversations;
    this.devices = devices;
    this.relationshipDirectory = relationshipDirectory;
    this.clock = clock;
  }

  /**
   * Returns the conversation between the caller and the peer, creating it if needed. Participant device lists are
   * re-derived from the device table on every call.
   */
  public ConversationView findOrCreate(final long callerId, final long peerUserId) {
    if (callerId == peerUserId) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST, "Cannot open a conversation with yourself");
    }

    if (!relationshipDirectory.exists(peerUserId)) {
      throw new KeyServerException(ErrorCode.NOT_FOUND, "User not found");
    }

    if (relationshipDirectory.isBlockedEitherWay(callerId, peerUserId)) {
      throw new KeyServerException(ErrorCode.BLOCKED, "Blocked");
    }

    for (int attempt = 1; ; attempt++) {
      try {
        final ConversationView view = database.inTransaction(handle -> {
          final Optional<Conversation> existing = conversations.findBetween(handle, callerId, peerUserId);

          if (existing.isPresent()) {
            return new ConversationView(existing.get(), refreshParticipants(handle, existing.get().id()), false);
          }

          final Instant now = clock.instant();
          final Conversation conversation =
              new Conversation(UUID.randomUUID(), PairKeys.of(callerId, peerUserId), now, null);

          final List<ConversationParticipant> participants = List.of(
              new ConversationParticipant(conversation.id(), Math.min(callerId, peerUserId),
                  devices.getActiveDeviceIds(handle, Math.min(callerId, peerUserId))),
              new ConversationParticipant(conversation.id(), Math.max(callerId, peerUserId),
                  devices.getActiveDeviceIds(handle, Math.max(callerId, peerUserId))));

          conversations.create(handle, conversation, participants);

          return new ConversationView(conversation, participants, true);
        });

        Metrics.counter(FIND_OR_CREATE_COUNTER_NAME, "created", String.valueOf(view.created())).increment();

        return view;
      } catch (final UnableToExecuteStatementException e) {
        if (!UniqueConstraintViolations.isUniqueViolation(e) || attempt >= MAX_CREATE_ATTEMPTS) {
          throw e;
        }

        logger.debug("Lost race creating conversation between {} and {}; re-reading", callerId, peerUserId);
      }
    }
  }

  public List<ConversationSummary> listConversations(final long callerId, final int limit, final int offset) {
    return conversations.getSummaries(callerId, limit, offset);
  }

  /**
   * Returns the conversation if the caller participates in it.
   */
  public ConversationView getConversation(final long callerId, final UUID conversationId) {
    return database.inTransaction(handle -> {
      final Conversation conversation = conversations.get(handle, conversationId)
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Conversation not found"));

      final ConversationView view = new ConversationView(conversation, refreshParticipants(handle, conversationId),
          false);

      if (!view.hasParticipant(callerId)) {
        throw new KeyServerException(ErrorCode.NOT_FOUND, "Conversation not found");
      }

      return view;
    });
  }

  private List<ConversationParticipant> refreshParticipants(final Handle handle, final UUID conversationId) {
    final List<ConversationParticipant> refreshed = new ArrayList<>();

    for (final ConversationParticipant participant : conversations.getParticipants(handle, conversationId)) {
      final List<UUID> activeDeviceIds = devices.getActiveDeviceIds(handle, participant.userId());

      if (!activeDeviceIds.equals(participant.deviceIds())) {
        conversations.updateDeviceIds(handle, conversationId, participant.userId(), activeDeviceIds);
      }

      refreshed.add(new ConversationParticipant(conversationId, participant.userId(), activeDeviceIds));
    }

    return refreshed;
  }
}
