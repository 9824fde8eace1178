/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.jdbi.v3.core.statement.Query;
import org.whispersystems.keyserver.storage.mappers.DeliveryReceiptRowMapper;
import org.whispersystems.keyserver.storage.mappers.ResultSets;
import org.whispersystems.keyserver.storage.mappers.StoredMessageRowMapper;

/**
 * Stored ciphertext envelopes for conversations and groups, and their per-recipient delivery receipts.
 */
public class Messages {

  public static final String ID                = "id";
  public static final String THREAD_TYPE       = "thread_type";
  public static final String THREAD_ID         = "thread_id";
  public static final String SENDER_USER_ID    = "sender_user_id";
  public static final String SENDER_DEVICE_ID  = "sender_device_id";
  public static final String CIPHERTEXT        = "ciphertext";
  public static final String PROTO             = "proto";
  public static final String GROUP_EPOCH       = "group_epoch";
  public static final String CREATED_AT        = "created_at";
  public static final String CLIENT_MESSAGE_ID = "client_message_id";

  public static final String RECEIPT_MESSAGE_ID        = "message_id";
  public static final String RECEIPT_RECIPIENT_USER_ID = "recipient_user_id";
  public static final String RECEIPT_DELIVERED_AT      = "delivered_at";
  public static final String RECEIPT_READ_AT           = "read_at";

  private static final Timer GET_PAGE_TIMER = Metrics.timer(name(Messages.class, "getPage"));
  private static final Timer WINDOW_USAGE_TIMER = Metrics.timer(name(Messages.class, "windowUsage"));

  private final FaultTolerantDatabase database;

  public Messages(FaultTolerantDatabase database) {
    this.database = database;
    this.database.getDatabase().registerRowMapper(new StoredMessageRowMapper());
    this.database.getDatabase().registerRowMapper(new DeliveryReceiptRowMapper());
  }

  public void insert(Handle handle, StoredMessage message, List<Long> recipientUserIds) {
    handle.createUpdate("""
            INSERT INTO messages (id, thread_type, thread_id, sender_user_id, sender_device_id, ciphertext, proto,
                                  group_epoch, created_at, client_message_id)
            VALUES (:id, :thread_type, :thread_id, :sender_user_id, :sender_device_id, :ciphertext, :proto,
                    :group_epoch, :created_at, :client_message_id)
            """)
        .bind(ID, message.id())
        .bind(THREAD_TYPE, ResultSets.toColumnValue(message.threadType()))
        .bind(THREAD_ID, message.threadId())
        .bind(SENDER_USER_ID, message.senderUserId())
        .bind(SENDER_DEVICE_ID, message.senderDeviceId())
        .bind(CIPHERTEXT, message.ciphertext())
        .bind(PROTO, message.proto())
        .bind(GROUP_EPOCH, message.groupEpoch())
        .bind(CREATED_AT, message.createdAt().toEpochMilli())
        .bind(CLIENT_MESSAGE_ID, message.clientMessageId())
        .execute();

    if (recipientUserIds.isEmpty()) {
      return;
    }

    final PreparedBatch preparedBatch = handle.prepareBatch(
        "INSERT INTO delivery_receipts (message_id, recipient_user_id) VALUES (:message_id, :recipient_user_id)");

    for (long recipientUserId : recipientUserIds) {
      preparedBatch.bind("message_id", message.id())
                   .bind("recipient_user_id", recipientUserId)
                   .add();
    }

    preparedBatch.execute();
  }

  public Optional<StoredMessage> findByClientMessageId(Handle handle, UUID threadId, long senderUserId,
      String clientMessageId) {

    return handle.createQuery("""
            SELECT * FROM messages
            WHERE thread_id = :thread_id AND sender_user_id = :sender_user_id AND client_message_id = :client_message_id
            """)
        .bind("thread_id", threadId)
        .bind("sender_user_id", senderUserId)
        .bind("client_message_id", clientMessageId)
        .mapTo(StoredMessage.class)
        .findOne();
  }

  public Optional<StoredMessage> findByClientMessageId(UUID threadId, long senderUserId, String clientMessageId) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        findByClientMessageId(handle, threadId, senderUserId, clientMessageId)));
  }

  public Optional<StoredMessage> get(UUID messageId) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("SELECT * FROM messages WHERE id = :id")
            .bind("id", messageId)
            .mapTo(StoredMessage.class)
            .findOne()));
  }

  /**
   * Returns up to {@code limit} messages of the thread in chronological order. With a {@code before} cursor the page
   * holds the newest messages older than the cursor; with an {@code after} cursor, the oldest messages newer than it;
   * with neither, the newest messages of the thread.
   */
  public List<StoredMessage> getPage(UUID threadId, Optional<StoredMessage> before, Optional<StoredMessage> after,
      int limit) {

    return GET_PAGE_TIMER.record(() -> database.with(jdbi -> jdbi.withHandle(handle -> {
      if (after.isPresent()) {
        return handle.createQuery("""
                SELECT * FROM messages
                WHERE thread_id = :thread_id
                  AND (created_at > :created_at OR (created_at = :created_at AND id > :id))
                ORDER BY created_at ASC, id ASC
                LIMIT :limit
                """)
            .bind("thread_id", threadId)
            .bind("created_at", after.get().createdAt().toEpochMilli())
            .bind("id", after.get().id())
            .bind("limit", limit)
            .mapTo(StoredMessage.class)
            .list();
      }

      final List<StoredMessage> descending;

      if (before.isPresent()) {
        descending = handle.createQuery("""
                SELECT * FROM messages
                WHERE thread_id = :thread_id
                  AND (created_at < :created_at OR (created_at = :created_at AND id < :id))
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """)
            .bind("thread_id", threadId)
            .bind("created_at", before.get().createdAt().toEpochMilli())
            .bind("id", before.get().id())
            .bind("limit", limit)
            .mapTo(StoredMessage.class)
            .list();
      } else {
        descending = handle.createQuery(
                "SELECT * FROM messages WHERE thread_id = :thread_id ORDER BY created_at DESC, id DESC LIMIT :limit")
            .bind("thread_id", threadId)
            .bind("limit", limit)
            .mapTo(StoredMessage.class)
            .list();
      }

      final List<StoredMessage> chronological = new ArrayList<>(descending);
      Collections.reverse(chronological);

      return chronological;
    })));
  }

  /**
   * Locks the sender's row in the host {@code users} table for the rest of the transaction, so that the sender's
   * concurrent sends are rate limited one after another.
   */
  public void lockSender(Handle handle, long senderUserId) {
    handle.createQuery("SELECT id FROM users WHERE id = :id FOR UPDATE")
        .bind("id", senderUserId)
        .mapTo(Long.class)
        .findOne();
  }

  /**
   * Counts the sender's messages, across every thread, created after {@code since}.
   */
  public WindowUsage getUsageSince(Handle handle, long senderUserId, Instant since, int limit) {
    return WINDOW_USAGE_TIMER.record(() -> windowUsage(handle,
        "sender_user_id = :sender_user_id AND created_at > :since",
        senderUserId, null, since, limit));
  }

  /**
   * Counts the sender's messages in one thread created after {@code since}.
   */
  public WindowUsage getUsageSince(Handle handle, long senderUserId, UUID threadId, Instant since, int limit) {
    return WINDOW_USAGE_TIMER.record(() -> windowUsage(handle,
        "sender_user_id = :sender_user_id AND thread_id = :thread_id AND created_at > :since",
        senderUserId, threadId, since, limit));
  }

  private static WindowUsage windowUsage(Handle handle, String condition, long senderUserId, @Nullable UUID threadId,
      Instant since, int limit) {

    final int count = bindWindow(handle.createQuery("SELECT COUNT(*) FROM messages WHERE " + condition),
        senderUserId, threadId, since)
        .mapTo(Integer.class)
        .one();

    if (count < limit) {
      return new WindowUsage(count, Optional.empty());
    }

    // the window admits another message once the (count - limit + 1) oldest messages have aged out
    final Optional<Instant> limitingMessageCreatedAt = bindWindow(handle.createQuery(
            "SELECT created_at FROM messages WHERE " + condition + " ORDER BY created_at LIMIT 1 OFFSET :offset"),
        senderUserId, threadId, since)
        .bind("offset", count - limit)
        .mapTo(Long.class)
        .findOne()
        .map(Instant::ofEpochMilli);

    return new WindowUsage(count, limitingMessageCreatedAt);
  }

  private static Query bindWindow(Query query, long senderUserId, @Nullable UUID threadId, Instant since) {
    query.bind("sender_user_id", senderUserId).bind("since", since.toEpochMilli());

    if (threadId != null) {
      query.bind("thread_id", threadId);
    }

    return query;
  }

  public Optional<DeliveryReceipt> getReceipt(UUID messageId, long recipientUserId) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("""
                SELECT * FROM delivery_receipts WHERE message_id = :message_id AND recipient_user_id = :recipient_user_id
                """)
            .bind("message_id", messageId)
            .bind("recipient_user_id", recipientUserId)
            .mapTo(DeliveryReceipt.class)
            .findOne()));
  }

  /**
   * Sets the receipt's delivery time unless it is already set. Returns true if this call set it.
   */
  public boolean markDelivered(UUID messageId, long recipientUserId, Instant now) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createUpdate("""
                UPDATE delivery_receipts SET delivered_at = :now
                WHERE message_id = :message_id AND recipient_user_id = :recipient_user_id AND delivered_at IS NULL
                """)
            .bind("message_id", messageId)
            .bind("recipient_user_id", recipientUserId)
            .bind("now", now.toEpochMilli())
            .execute() == 1));
  }

  /**
   * Sets the receipt's read time unless it is already set. Returns true if this call set it.
   */
  public boolean markRead(UUID messageId, long recipientUserId, Instant now) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createUpdate("""
                UPDATE delivery_receipts SET read_at = :now
                WHERE message_id = :message_id AND recipient_user_id = :recipient_user_id AND read_at IS NULL
                """)
            .bind("message_id", messageId)
            .bind("recipient_user_id", recipientUserId)
            .bind("now", now.toEpochMilli())
            .execute() == 1));
  }
}
