/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.whispersystems.keyserver.storage.mappers.ConversationParticipantRowMapper;
import org.whispersystems.keyserver.storage.mappers.ConversationRowMapper;
import org.whispersystems.keyserver.util.PairKeys;

public class Conversations {

  public static final String ID              = "id";
  public static final String PAIR_KEY        = "pair_key";
  public static final String CREATED_AT      = "created_at";
  public static final String LAST_MESSAGE_AT = "last_message_at";

  public static final String PARTICIPANT_CONVERSATION_ID = "conversation_id";
  public static final String PARTICIPANT_USER_ID         = "user_id";
  public static final String PARTICIPANT_DEVICE_IDS      = "device_ids";

  private static final ConversationRowMapper CONVERSATION_ROW_MAPPER = new ConversationRowMapper();

  private final FaultTolerantDatabase database;

  public Conversations(FaultTolerantDatabase database) {
    this.database = database;
    this.database.getDatabase().registerRowMapper(CONVERSATION_ROW_MAPPER);
    this.database.getDatabase().registerRowMapper(new ConversationParticipantRowMapper());
  }

  /**
   * Finds the conversation between two users, first by pair key and then, for conversations created before pair keys
   * were recorded, by participant membership.
   */
  public Optional<Conversation> findBetween(Handle handle, long firstUserId, long secondUserId) {
    final Optional<Conversation> byPairKey = handle.createQuery("SELECT * FROM conversations WHERE pair_key = :pair_key")
        .bind("pair_key", PairKeys.of(firstUserId, secondUserId))
        .mapTo(Conversation.class)
        .findOne();

    if (byPairKey.isPresent()) {
      return byPairKey;
    }

    return handle.createQuery("""
            SELECT * FROM conversations WHERE id IN (
              SELECT conversation_id FROM conversation_participants
              WHERE user_id IN (:first_user_id, :second_user_id)
              GROUP BY conversation_id
              HAVING COUNT(DISTINCT user_id) = 2)
            ORDER BY created_at, id
            LIMIT 1
            """)
        .bind("first_user_id", firstUserId)
        .bind("second_user_id", secondUserId)
        .mapTo(Conversation.class)
        .findFirst();
  }

  public boolean existsBetween(long firstUserId, long secondUserId) {
    return database.with(jdbi -> jdbi.withHandle(handle -> findBetween(handle, firstUserId, secondUserId).isPresent()));
  }

  public Optional<Conversation> get(Handle handle, UUID conversationId) {
    return handle.createQuery("SELECT * FROM conversations WHERE id = :id")
        .bind("id", conversationId)
        .mapTo(Conversation.class)
        .findOne();
  }

  /**
   * Inserts a conversation and both participant rows. Fails with a constraint violation if a conversation with the
   * same pair key already exists.
   */
  public void create(Handle handle, Conversation conversation, List<ConversationParticipant> participants) {
    handle.createUpdate("INSERT INTO conversations (id, pair_key, created_at) VALUES (:id, :pair_key, :created_at)")
        .bind("id", conversation.id())
        .bind("pair_key", conversation.pairKey())
        .bind("created_at", conversation.createdAt().toEpochMilli())
        .execute();

    final PreparedBatch preparedBatch = handle.prepareBatch(
        "INSERT INTO conversation_participants (conversation_id, user_id, device_ids) VALUES (:conversation_id, :user_id, :device_ids)");

    for (ConversationParticipant participant : participants) {
      preparedBatch.bind("conversation_id", conversation.id())
                   .bind("user_id", participant.userId())
                   .bind("device_ids", ConversationParticipantRowMapper.formatDeviceIds(participant.deviceIds()))
                   .add();
    }

    preparedBatch.execute();
  }

  public List<ConversationParticipant> getParticipants(Handle handle, UUID conversationId) {
    return handle.createQuery("SELECT * FROM conversation_participants WHERE conversation_id = :conversation_id ORDER BY user_id")
        .bind("conversation_id", conversationId)
        .mapTo(ConversationParticipant.class)
        .list();
  }

  public void updateDeviceIds(Handle handle, UUID conversationId, long userId, List<UUID> deviceIds) {
    handle.createUpdate("""
            UPDATE conversation_participants SET device_ids = :device_ids
            WHERE conversation_id = :conversation_id AND user_id = :user_id
            """)
        .bind("conversation_id", conversationId)
        .bind("user_id", userId)
        .bind("device_ids", ConversationParticipantRowMapper.formatDeviceIds(deviceIds))
        .execute();
  }

  public void setLastMessageAt(Handle handle, UUID conversationId, Instant lastMessageAt) {
    handle.createUpdate("UPDATE conversations SET last_message_at = :last_message_at WHERE id = :id")
        .bind("id", conversationId)
        .bind("last_message_at", lastMessageAt.toEpochMilli())
        .execute();
  }

  public List<ConversationSummary> getSummaries(long userId, int limit, int offset) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("""
                SELECT c.*, peer.user_id AS peer_user_id,
                  (SELECT COUNT(*) FROM messages m JOIN delivery_receipts r ON r.message_id = m.id
                   WHERE m.thread_id = c.id AND r.recipient_user_id = :user_id AND r.read_at IS NULL) AS unread_count
                FROM conversations c
                JOIN conversation_participants me ON me.conversation_id = c.id AND me.user_id = :user_id
                JOIN conversation_participants peer ON peer.conversation_id = c.id AND peer.user_id <> :user_id
                ORDER BY COALESCE(c.last_message_at, c.created_at) DESC, c.id
                LIMIT :limit OFFSET :offset
                """)
            .bind("user_id", userId)
            .bind("limit", limit)
            .bind("offset", offset)
            .map((resultSet, ctx) -> new ConversationSummary(CONVERSATION_ROW_MAPPER.map(resultSet, ctx),
                resultSet.getLong("peer_user_id"),
                resultSet.getInt("unread_count")))
            .list()));
  }
}
