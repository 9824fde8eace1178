/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.configuration.GroupsConfiguration;
import org.whispersystems.keyserver.controllers.ErrorCode;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.identity.RelationshipDirectory;

/**
 * Link and direct invites to groups, and redemption of invite codes.
 */
public class GroupInvitesManager {

  private static final Logger logger = LoggerFactory.getLogger(GroupInvitesManager.class);

  private static final String CODE_COLLISION_COUNTER_NAME = name(GroupInvitesManager.class, "codeCollision");
  private static final String JOIN_COUNTER_NAME = name(GroupInvitesManager.class, "join");

  private final FaultTolerantDatabase database;
  private final GroupInvites groupInvites;
  private final Groups groups;
  private final GroupsManager groupsManager;
  private final RelationshipDirectory relationshipDirectory;
  private final GroupsConfiguration configuration;
  private final Supplier<String> codeGenerator;
  private final Clock clock;

  /**
   * @param joined false if the caller was already a member and nothing changed
   */
  public record JoinResult(UUID groupId, long epoch, boolean joined) {
  }

  public GroupInvitesManager(final FaultTolerantDatabase database,
      final GroupInvites groupInvites,
      final Groups groups,
      final GroupsManager groupsManager,
      final RelationshipDirectory relationshipDirectory,
      final GroupsConfiguration configuration,
      final Supplier<String> codeGenerator,
      final Clock clock) {

    this.database = database;
    this.groupInvites = groupInvites;
    this.groups = groups;
    this.groupsManager = groupsManager;
    this.relationshipDirectory = relationshipDirectory;
    this.configuration = configuration;
    this.codeGenerator = codeGenerator;
    this.clock = clock;
  }

  /**
   * Creates an invite with a fresh unique code, retrying with a new code when a generated one is already taken. The
   * caller's role and the group's open state are checked under the group lock in the transaction that inserts.
   */
  public GroupInvite createInvite(final long callerId,
      final UUID groupId,
      final InviteType type,
      @Nullable final Long targetUserId,
      @Nullable final Instant expiresAt,
      @Nullable final Integer maxUses) {

    groupsManager.requireEnabled();

    final Instant now = clock.instant();

    if (type == InviteType.DIRECT && targetUserId == null) {
      throw new KeyServerException(ErrorCode.TARGET_USER_REQUIRED, "Direct invites require a target user");
    }

    if (expiresAt != null && !expiresAt.isAfter(now)) {
      throw new KeyServerException(ErrorCode.EXPIRY_IN_PAST, "Expiry must be in the future");
    }

    if (maxUses != null && maxUses < 1) {
      throw new KeyServerException(ErrorCode.INVALID_REQUEST, "maxUses must be positive");
    }

    if (targetUserId != null && !relationshipDirectory.exists(targetUserId)) {
      throw new KeyServerException(ErrorCode.NOT_FOUND, "User not found");
    }

    final Instant effectiveExpiry = expiresAt != null ? expiresAt : now.plus(configuration.getInviteExpiry());

    for (int attempt = 1; attempt <= configuration.getInviteCodeAttempts(); attempt++) {
      final GroupInvite invite = new GroupInvite(UUID.randomUUID(), groupId, callerId, type, codeGenerator.get(),
          effectiveExpiry, maxUses, 0, type == InviteType.DIRECT ? targetUserId : null, now);

      try {
        // a unique violation aborts the transaction, so every attempt takes the group lock afresh
        database.useTransaction(handle -> {
          groupsManager.lockOpenGroup(handle, groupId);
          groupsManager.requireManager(handle, groupId, callerId);
          groupInvites.insert(handle, invite);
        });

        return invite;
      } catch (final UnableToExecuteStatementException e) {
        if (!UniqueConstraintViolations.isUniqueViolation(e)) {
          throw e;
        }

        Metrics.counter(CODE_COLLISION_COUNTER_NAME).increment();
        logger.debug("Invite code collision on attempt {}", attempt);
      }
    }

    throw new KeyServerException(ErrorCode.INVITE_CODE_CONFLICT, "Could not generate a unique invite code");
  }

  public List<GroupInvite> listInvites(final long callerId, final UUID groupId) {
    groupsManager.requireEnabled();

    database.useTransaction(handle -> {
      groups.get(handle, groupId).orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));
      groupsManager.requireManager(handle, groupId, callerId);
    });

    return groupInvites.getActive(groupId, clock.instant());
  }

  public void revokeInvite(final long callerId, final UUID groupId, final UUID inviteId) {
    groupsManager.requireEnabled();

    database.useTransaction(handle -> {
      groups.getForUpdate(handle, groupId)
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));
      groupsManager.requireManager(handle, groupId, callerId);

      final GroupInvite invite = groupInvites.get(handle, inviteId)
          .filter(i -> i.groupId().equals(groupId))
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Invite not found"));

      groupInvites.delete(handle, invite.id());
    });
  }

  /**
   * Redeems an invite code. Checks, in order: expiry, remaining uses, closed group, ban, capacity, and for direct
   * invites the intended recipient. A caller who is already an active member succeeds without using the invite.
   */
  public JoinResult joinByCode(final long callerId, final String code) {
    groupsManager.requireEnabled();

    final GroupInvite invite = groupInvites.getByCode(code)
        .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Invite not found"));

    final JoinResult result = database.inTransaction(handle -> {
      final Group group = groups.getForUpdate(handle, invite.groupId())
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));

      // Uses are re-read under the group lock so concurrent redemptions cannot exceed maxUses.
      final GroupInvite current = groupInvites.get(handle, invite.id())
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Invite not found"));

      if (current.isExpired(clock.instant())) {
        throw new KeyServerException(ErrorCode.INVITE_EXPIRED, "Invite has expired");
      }

      if (current.isExhausted()) {
        throw new KeyServerException(ErrorCode.MAX_USES, "Invite has no uses left");
      }

      if (group.closed()) {
        throw new KeyServerException(ErrorCode.GROUP_CLOSED, "Group is closed");
      }

      if (groups.getBan(handle, group.id(), callerId).isPresent()) {
        throw new KeyServerException(ErrorCode.BANNED, "Banned from this group");
      }

      final Optional<GroupParticipant> existing = groups.getParticipant(handle, group.id(), callerId);
      final boolean alreadyMember = existing.map(GroupParticipant::isActive).orElse(false);

      if (!alreadyMember && groups.countActiveParticipants(handle, group.id()) >= group.maxParticipants()) {
        throw new KeyServerException(ErrorCode.GROUP_FULL, "Group is full");
      }

      if (current.type() == InviteType.DIRECT && !Long.valueOf(callerId).equals(current.targetUserId())) {
        throw new KeyServerException(ErrorCode.NOT_INVITED, "This invite is for another user");
      }

      if (alreadyMember) {
        return new JoinResult(group.id(), group.epoch(), false);
      }

      groupInvites.incrementUses(handle, current.id());

      return new JoinResult(group.id(), groupsManager.admit(handle, group.id(), callerId, existing), true);
    });

    Metrics.counter(JOIN_COUNTER_NAME, "joined", String.valueOf(result.joined())).increment();

    if (result.joined()) {
      groupsManager.publishEpochChanged(result.groupId(), result.epoch(), GroupsManager.REASON_MEMBER_JOINED);
    }

    return result;
  }
}
