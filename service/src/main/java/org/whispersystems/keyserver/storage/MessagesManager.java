/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import javax.annotation.Nullable;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.configuration.MessagesConfiguration;
import org.whispersystems.keyserver.controllers.ErrorCode;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.controllers.RateLimitExceededException;
import org.whispersystems.keyserver.identity.RelationshipDirectory;
import org.whispersystems.keyserver.limits.RateLimiters;
import org.whispersystems.keyserver.push.EventPublisher;
import org.whispersystems.keyserver.push.LiveEvents;

/**
 * Stores ciphertext envelopes for conversations and groups and tracks their delivery.
 * <p>
 * A send is committed first, with its message row and one receipt per recipient in a single transaction; live
 * notification happens afterwards and never affects the outcome. Clients that miss a notification catch up by
 * paging with an {@code after} cursor.
 */
public class MessagesManager {

  private static final Logger logger = LoggerFactory.getLogger(MessagesManager.class);

  private static final String SEND_COUNTER_NAME = name(MessagesManager.class, "send");
  private static final String RECEIPT_COUNTER_NAME = name(MessagesManager.class, "receipt");

  public static final int SENDER_KEY_MESSAGE_PROTO = 10;
  public static final int SENDER_KEY_DISTRIBUTION_PROTO = 11;

  static final String RECEIPT_DELIVERED = "delivered";
  static final String RECEIPT_READ = "read";

  private final FaultTolerantDatabase database;
  private final Messages messages;
  private final Conversations conversations;
  private final Groups groups;
  private final DevicesManager devicesManager;
  private final RelationshipDirectory relationshipDirectory;
  private final RateLimiters rateLimiters;
  private final EventPublisher eventPublisher;
  private final MessagesConfiguration configuration;
  private final Clock clock;

  public record SendResult(StoredMessage message, boolean duplicate) {
  }

  public MessagesManager(final FaultTolerantDatabase database,
      final Messages messages,
      final Conversations conversations,
      final Groups groups,
      final DevicesManager devicesManager,
      final RelationshipDirectory relationshipDirectory,
      final RateLimiters rateLimiters,
      final EventPublisher eventPublisher,
      final MessagesConfiguration configuration,
      final Clock clock) {

    this.database = database;
    this.messages = messages;
    this.conversations = conversations;
    this.groups = groups;
    this.devicesManager = devicesManager;
    this.relationshipDirectory = relationshipDirectory;
    this.rateLimiters = rateLimiters;
    this.eventPublisher = eventPublisher;
    this.configuration = configuration;
    this.clock = clock;
  }

  public SendResult sendDirect(final long callerId,
      final UUID conversationId,
      final UUID deviceId,
      final String ciphertext,
      final int proto,
      @Nullable final String clientMessageId) throws RateLimitExceededException {

    requireEnabled();

    if (proto < 0) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST, "Invalid proto tag");
    }

    final byte[] ciphertextBytes = decodeCiphertext(ciphertext);

    final List<ConversationParticipant> participants = database.with(jdbi -> jdbi.withHandle(handle -> {
      conversations.get(handle, conversationId)
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Conversation not found"));
      return conversations.getParticipants(handle, conversationId);
    }));

    if (participants.stream().noneMatch(participant -> participant.userId() == callerId)) {
      throw new KeyServerException(ErrorCode.NOT_MEMBER, "Not a participant in this conversation");
    }

    final List<Long> recipients = participants.stream()
        .map(ConversationParticipant::userId)
        .filter(userId -> userId != callerId)
        .toList();

    devicesManager.getActingDevice(callerId, deviceId);

    for (final long recipient : recipients) {
      if (relationshipDirectory.isBlockedEitherWay(callerId, recipient)) {
        throw new KeyServerException(ErrorCode.BLOCKED, "Blocked");
      }
    }

    final Optional<SendResult> duplicate = findDuplicate(conversationId, callerId, clientMessageId);

    if (duplicate.isPresent()) {
      return duplicate.get();
    }

    final StoredMessage message = new StoredMessage(UUID.randomUUID(), ThreadType.CONVERSATION, conversationId,
        callerId, deviceId, ciphertextBytes, proto, null, clock.instant(), clientMessageId);

    final Optional<SendResult> raced = store(message, handle -> {
      conversations.setLastMessageAt(handle, conversationId, message.createdAt());
      return recipients;
    });

    if (raced.isPresent()) {
      return raced.get();
    }

    final LiveEvents.MessageCreated event = messageCreated(message);

    publish(LiveEvents.conversationChannel(conversationId), event);
    recipients.forEach(recipient -> publish(LiveEvents.userChannel(recipient), event));

    return new SendResult(message, false);
  }

  /**
   * Sends a sender-key message or sender-key distribution message to a group. The message must be encrypted for the
   * group's current epoch; otherwise the send fails with {@code EPOCH_STALE} and the current epoch.
   */
  public SendResult sendGroup(final long callerId,
      final UUID groupId,
      final UUID deviceId,
      final String ciphertext,
      final int proto,
      final long groupEpoch,
      @Nullable final String clientMessageId) throws RateLimitExceededException {

    requireEnabled();

    if (proto != SENDER_KEY_MESSAGE_PROTO && proto != SENDER_KEY_DISTRIBUTION_PROTO) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST, "Group messages must use a sender-key proto tag");
    }

    final byte[] ciphertextBytes = decodeCiphertext(ciphertext);

    final Group group = groups.get(groupId)
        .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));

    if (group.closed()) {
      throw new KeyServerException(ErrorCode.GROUP_CLOSED, "Group is closed");
    }

    requireGroupMember(groupId, callerId);
    devicesManager.getActingDevice(callerId, deviceId);

    final Optional<SendResult> duplicate = findDuplicate(groupId, callerId, clientMessageId);

    if (duplicate.isPresent()) {
      return duplicate.get();
    }

    if (group.epoch() != groupEpoch) {
      throw KeyServerException.epochStale(group.epoch());
    }

    final StoredMessage message = new StoredMessage(UUID.randomUUID(), ThreadType.GROUP, groupId, callerId, deviceId,
        ciphertextBytes, proto, groupEpoch, clock.instant(), clientMessageId);

    final Optional<SendResult> raced = store(message, handle -> {
      // membership changes hold this lock while they bump the epoch, so the recipients below match the epoch
      final Group current = groups.getForUpdate(handle, groupId)
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));

      if (current.closed()) {
        throw new KeyServerException(ErrorCode.GROUP_CLOSED, "Group is closed");
      }

      if (current.epoch() != groupEpoch) {
        throw KeyServerException.epochStale(current.epoch());
      }

      groups.getParticipant(handle, groupId, callerId)
          .filter(GroupParticipant::isActive)
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_MEMBER, "Not a member of this group"));

      groups.setLastMessageAt(handle, groupId, message.createdAt());

      return groups.getActiveParticipants(handle, groupId).stream()
          .map(GroupParticipant::userId)
          .filter(userId -> userId != callerId)
          .toList();
    });

    if (raced.isPresent()) {
      return raced.get();
    }

    publish(LiveEvents.groupChannel(groupId), messageCreated(message));

    return new SendResult(message, false);
  }

  /**
   * Returns a page of a thread's messages in chronological order.
   *
   * @param before a message id; the page holds the newest messages older than it
   * @param after  a message id; the page holds the oldest messages newer than it
   */
  public List<StoredMessage> getMessages(final long callerId,
      final ThreadType threadType,
      final UUID threadId,
      @Nullable final Integer limit,
      @Nullable final UUID before,
      @Nullable final UUID after) {

    requireEnabled();

    if (before != null && after != null) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST, "Only one of before and after may be given");
    }

    final int pageSize = limit == null ? configuration.getDefaultPageSize()
        : Math.min(limit, configuration.getMaxPageSize());

    if (pageSize < 1) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST, "limit must be positive");
    }

    if (threadType == ThreadType.CONVERSATION) {
      final boolean participant = database.with(jdbi -> jdbi.withHandle(handle -> {
        conversations.get(handle, threadId)
            .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Conversation not found"));

        return conversations.getParticipants(handle, threadId).stream()
            .anyMatch(p -> p.userId() == callerId);
      }));

      if (!participant) {
        throw new KeyServerException(ErrorCode.NOT_MEMBER, "Not a participant in this conversation");
      }
    } else {
      groups.get(threadId).orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));
      requireGroupMember(threadId, callerId);
    }

    return messages.getPage(threadId, cursor(threadId, before), cursor(threadId, after), pageSize);
  }

  public DeliveryReceipt markDelivered(final long callerId, final UUID messageId) {
    return updateReceipt(callerId, messageId, RECEIPT_DELIVERED);
  }

  public DeliveryReceipt markRead(final long callerId, final UUID messageId) {
    return updateReceipt(callerId, messageId, RECEIPT_READ);
  }

  private DeliveryReceipt updateReceipt(final long callerId, final UUID messageId, final String status) {
    requireEnabled();

    final StoredMessage message = messages.get(messageId)
        .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Message not found"));

    if (messages.getReceipt(messageId, callerId).isEmpty()) {
      throw new KeyServerException(ErrorCode.FORBIDDEN, "Caller is not a recipient of this message");
    }

    final Instant now = clock.instant();
    final boolean changed = RECEIPT_READ.equals(status)
        ? messages.markRead(messageId, callerId, now)
        : messages.markDelivered(messageId, callerId, now);

    Metrics.counter(RECEIPT_COUNTER_NAME, "status", status, "changed", String.valueOf(changed)).increment();

    if (changed) {
      publish(LiveEvents.userChannel(message.senderUserId()),
          new LiveEvents.ReceiptUpdated(messageId, callerId, status, now));
    }

    return messages.getReceipt(messageId, callerId).orElseThrow();
  }

  private Optional<SendResult> findDuplicate(final UUID threadId, final long senderUserId,
      @Nullable final String clientMessageId) {

    if (clientMessageId == null) {
      return Optional.empty();
    }

    final Optional<SendResult> duplicate = messages.findByClientMessageId(threadId, senderUserId, clientMessageId)
        .map(existing -> new SendResult(existing, true));

    duplicate.ifPresent(ignored -> Metrics.counter(SEND_COUNTER_NAME, "outcome", "duplicate").increment());

    return duplicate;
  }

  /**
   * Stores the message and one receipt per recipient in one transaction. The sender is locked first so that the rate
   * limits count the sender's concurrent sends one after another. The callback then checks the thread and returns the
   * recipients. If a concurrent send with the same client message id won the race, returns that send as a duplicate
   * instead.
   */
  private Optional<SendResult> store(final StoredMessage message, final Function<Handle, List<Long>> prepareThread)
      throws RateLimitExceededException {

    try {
      database.useTransaction(handle -> {
        messages.lockSender(handle, message.senderUserId());

        final List<Long> recipients = prepareThread.apply(handle);

        rateLimiters.validateSend(handle, message.senderUserId(), message.threadId());
        messages.insert(handle, message, recipients);
      });
    } catch (final UnableToExecuteStatementException e) {
      if (message.clientMessageId() == null || !UniqueConstraintViolations.isUniqueViolation(e)) {
        throw e;
      }

      return Optional.of(findDuplicate(message.threadId(), message.senderUserId(), message.clientMessageId())
          .orElseThrow(() -> e));
    }

    Metrics.counter(SEND_COUNTER_NAME, "outcome", "stored", "threadType", message.threadType().name().toLowerCase())
        .increment();

    return Optional.empty();
  }

  private Optional<StoredMessage> cursor(final UUID threadId, @Nullable final UUID messageId) {
    if (messageId == null) {
      return Optional.empty();
    }

    return Optional.of(messages.get(messageId)
        .filter(message -> message.threadId().equals(threadId))
        .orElseThrow(() -> new KeyServerException(ErrorCode.INVALID_REQUEST, "Cursor does not belong to this thread")));
  }

  private void requireGroupMember(final UUID groupId, final long userId) {
    groups.getParticipant(groupId, userId)
        .filter(GroupParticipant::isActive)
        .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_MEMBER, "Not a member of this group"));
  }

  private byte[] decodeCiphertext(final String ciphertext) {
    final byte[] bytes;

    try {
      bytes = Base64.getDecoder().decode(ciphertext);
    } catch (final IllegalArgumentException e) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST, "ciphertext is not valid base64");
    }

    if (bytes.length == 0) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST, "ciphertext is empty");
    }

    if (bytes.length > configuration.getMaxCiphertextBytes()) {
      throw new KeyServerException(ErrorCode.MESSAGE_TOO_LARGE,
          "ciphertext exceeds " + configuration.getMaxCiphertextBytes() + " bytes");
    }

    return bytes;
  }

  private void requireEnabled() {
    if (!configuration.isEnabled()) {
      throw new KeyServerException(ErrorCode.DISABLED, "Messaging is disabled");
    }
  }

  private static LiveEvents.MessageCreated messageCreated(final StoredMessage message) {
    return new LiveEvents.MessageCreated(message.threadType().name().toLowerCase(), message.threadId(), message.id(),
        message.senderUserId(), message.senderDeviceId(), message.proto(), message.groupEpoch(), message.createdAt());
  }

  private void publish(final String channel, final Object event) {
    try {
      eventPublisher.publish(channel, event);
    } catch (final RuntimeException e) {
      logger.warn("Failed to publish to {}", channel, e);
    }
  }
}
