/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;
import org.jdbi.v3.core.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.configuration.GroupsConfiguration;
import org.whispersystems.keyserver.controllers.ErrorCode;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.identity.RelationshipDirectory;
import org.whispersystems.keyserver.push.EventPublisher;
import org.whispersystems.keyserver.push.LiveEvents;

/**
 * Group membership and the group epoch.
 * <p>
 * Every operation that changes who can decrypt group traffic (add, join, remove, leave, ban) advances the epoch by
 * exactly one inside the same transaction and, once committed, announces the new epoch on the group channel. Role,
 * mute and unban changes leave the epoch alone. All membership mutations hold the group row lock for their duration.
 */
public class GroupsManager {

  private static final Logger logger = LoggerFactory.getLogger(GroupsManager.class);

  private static final String EPOCH_CHANGED_COUNTER_NAME = name(GroupsManager.class, "epochChanged");

  static final String REASON_MEMBERS_ADDED = "members_added";
  static final String REASON_MEMBER_JOINED = "member_joined";
  static final String REASON_MEMBER_REMOVED = "member_removed";
  static final String REASON_MEMBER_LEFT = "member_left";
  static final String REASON_MEMBER_BANNED = "member_banned";

  private final FaultTolerantDatabase database;
  private final Groups groups;
  private final SenderKeys senderKeys;
  private final DevicesManager devicesManager;
  private final RelationshipDirectory relationshipDirectory;
  private final EventPublisher eventPublisher;
  private final GroupsConfiguration configuration;
  private final Clock clock;

  public record AddMembersResult(List<Long> addedUserIds, long epoch) {
  }

  public GroupsManager(final FaultTolerantDatabase database,
      final Groups groups,
      final SenderKeys senderKeys,
      final DevicesManager devicesManager,
      final RelationshipDirectory relationshipDirectory,
      final EventPublisher eventPublisher,
      final GroupsConfiguration configuration,
      final Clock clock) {

    this.database = database;
    this.groups = groups;
    this.senderKeys = senderKeys;
    this.devicesManager = devicesManager;
    this.relationshipDirectory = relationshipDirectory;
    this.eventPublisher = eventPublisher;
    this.configuration = configuration;
    this.clock = clock;
  }

  public Group createGroup(final long callerId, final String title, @Nullable final String about) {
    requireEnabled();

    final Instant now = clock.instant();
    final Group group = new Group(UUID.randomUUID(), title, about, callerId, configuration.getMaxParticipants(), 0, 1,
        false, now, now, null, null);

    database.useTransaction(handle ->
        groups.create(handle, group, new GroupParticipant(group.id(), callerId, GroupRole.OWNER, false, now, null)));

    logger.debug("User {} created group {}", callerId, group.id());

    return group;
  }

  public Group getGroup(final long callerId, final UUID groupId) {
    requireEnabled();

    final Group group = groups.get(groupId)
        .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));

    requireActiveMember(groups.getParticipant(groupId, callerId));

    return group;
  }

  public List<Group> listGroups(final long callerId, final int limit, final int offset) {
    requireEnabled();
    return groups.getForMember(callerId, limit, offset);
  }

  public Group updateGroup(final long callerId, final UUID groupId, final String title, @Nullable final String about) {
    requireEnabled();

    return database.inTransaction(handle -> {
      lockOpenGroup(handle, groupId);
      requireManager(handle, groupId, callerId);

      groups.updateDetails(handle, groupId, title, about, clock.instant());

      return groups.get(handle, groupId).orElseThrow();
    });
  }

  /**
   * Closes the group. Closing is permanent and idempotent; a closed group accepts no further membership changes,
   * invites or messages.
   */
  public Group closeGroup(final long callerId, final UUID groupId) {
    requireEnabled();

    return database.inTransaction(handle -> {
      final Group group = groups.getForUpdate(handle, groupId)
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));

      if (requireActiveMember(groups.getParticipant(handle, groupId, callerId)).role() != GroupRole.OWNER) {
        throw new KeyServerException(ErrorCode.FORBIDDEN, "Only the owner may close the group");
      }

      if (!group.closed()) {
        groups.close(handle, groupId, clock.instant());
      }

      return groups.get(handle, groupId).orElseThrow();
    });
  }

  public List<GroupParticipant> listMembers(final long callerId, final UUID groupId) {
    requireEnabled();

    groups.get(groupId).orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));
    requireActiveMember(groups.getParticipant(groupId, callerId));

    return groups.getActiveParticipants(groupId);
  }

  /**
   * Adds the given users as members. Unknown, banned and already-active users are skipped. Capacity is checked
   * against the users that would actually be added, before anything is written. The epoch advances once if at least
   * one user was added.
   */
  public AddMembersResult addMembers(final long callerId, final UUID groupId, final List<Long> userIds) {
    requireEnabled();

    final AddMembersResult result = database.inTransaction(handle -> {
      final Group group = lockOpenGroup(handle, groupId);
      requireManager(handle, groupId, callerId);

      final List<Long> toAdd = new ArrayList<>();
      final List<Long> toReactivate = new ArrayList<>();

      for (final long userId : new LinkedHashSet<>(userIds)) {
        if (!relationshipDirectory.exists(userId) || groups.getBan(handle, groupId, userId).isPresent()) {
          continue;
        }

        final Optional<GroupParticipant> existing = groups.getParticipant(handle, groupId, userId);

        if (existing.isEmpty()) {
          toAdd.add(userId);
        } else if (!existing.get().isActive()) {
          toReactivate.add(userId);
        }
      }

      final List<Long> admitted = new ArrayList<>(toReactivate);
      admitted.addAll(toAdd);

      if (admitted.isEmpty()) {
        return new AddMembersResult(List.of(), group.epoch());
      }

      if (groups.countActiveParticipants(handle, groupId) + admitted.size() > group.maxParticipants()) {
        throw new KeyServerException(ErrorCode.GROUP_FULL, "Group is full");
      }

      final Instant now = clock.instant();

      toReactivate.forEach(userId -> groups.reactivateParticipant(handle, groupId, userId, now));
      toAdd.forEach(userId ->
          groups.insertParticipant(handle, new GroupParticipant(groupId, userId, GroupRole.MEMBER, false, now, null)));

      return new AddMembersResult(admitted, groups.incrementEpoch(handle, groupId, now));
    });

    if (!result.addedUserIds().isEmpty()) {
      publishEpochChanged(groupId, result.epoch(), REASON_MEMBERS_ADDED);
    }

    return result;
  }

  /**
   * Removes an active member. The owner cannot be removed.
   *
   * @return the new epoch
   */
  public long removeMember(final long callerId, final UUID groupId, final long userId) {
    requireEnabled();

    final long epoch = database.inTransaction(handle -> {
      lockOpenGroup(handle, groupId);
      requireManager(handle, groupId, callerId);

      final GroupParticipant target = groups.getParticipant(handle, groupId, userId)
          .filter(GroupParticipant::isActive)
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "User is not a member"));

      if (target.role() == GroupRole.OWNER) {
        throw new KeyServerException(ErrorCode.FORBIDDEN, "The owner cannot be removed");
      }

      groups.deleteParticipant(handle, groupId, userId);

      return groups.incrementEpoch(handle, groupId, clock.instant());
    });

    publishEpochChanged(groupId, epoch, REASON_MEMBER_REMOVED);

    return epoch;
  }

  /**
   * Removes the caller from the group. The owner must transfer ownership or close the group instead.
   *
   * @return the new epoch
   */
  public long leaveGroup(final long callerId, final UUID groupId) {
    requireEnabled();

    final long epoch = database.inTransaction(handle -> {
      lockOpenGroup(handle, groupId);

      if (requireActiveMember(groups.getParticipant(handle, groupId, callerId)).role() == GroupRole.OWNER) {
        throw new KeyServerException(ErrorCode.FORBIDDEN,
            "The owner cannot leave; transfer ownership or close the group");
      }

      groups.deleteParticipant(handle, groupId, callerId);

      return groups.incrementEpoch(handle, groupId, clock.instant());
    });

    publishEpochChanged(groupId, epoch, REASON_MEMBER_LEFT);

    return epoch;
  }

  public void promoteMember(final long callerId, final UUID groupId, final long userId) {
    requireEnabled();

    database.useTransaction(handle -> {
      lockOpenGroup(handle, groupId);
      requireManager(handle, groupId, callerId);

      final GroupParticipant target = requireActiveTarget(handle, groupId, userId);

      if (target.role() == GroupRole.MEMBER) {
        groups.setRole(handle, groupId, userId, GroupRole.ADMIN);
      }
    });
  }

  public void demoteAdmin(final long callerId, final UUID groupId, final long userId) {
    requireEnabled();

    database.useTransaction(handle -> {
      lockOpenGroup(handle, groupId);

      if (requireActiveMember(groups.getParticipant(handle, groupId, callerId)).role() != GroupRole.OWNER) {
        throw new KeyServerException(ErrorCode.FORBIDDEN, "Only the owner may demote admins");
      }

      final GroupParticipant target = requireActiveTarget(handle, groupId, userId);

      if (target.role() == GroupRole.ADMIN) {
        groups.setRole(handle, groupId, userId, GroupRole.MEMBER);
      }
    });
  }

  /**
   * Makes another active member the owner; the previous owner becomes an admin.
   */
  public void transferOwnership(final long callerId, final UUID groupId, final long newOwnerId) {
    requireEnabled();

    database.useTransaction(handle -> {
      lockOpenGroup(handle, groupId);

      if (requireActiveMember(groups.getParticipant(handle, groupId, callerId)).role() != GroupRole.OWNER) {
        throw new KeyServerException(ErrorCode.FORBIDDEN, "Only the owner may transfer ownership");
      }

      if (newOwnerId == callerId) {
        return;
      }

      requireActiveTarget(handle, groupId, newOwnerId);

      groups.setRole(handle, groupId, newOwnerId, GroupRole.OWNER);
      groups.setRole(handle, groupId, callerId, GroupRole.ADMIN);
    });

    logger.debug("Ownership of group {} transferred from {} to {}", groupId, callerId, newOwnerId);
  }

  /**
   * Bans a user, whether or not they are currently a member. Bans of the owner are refused.
   *
   * @return the new epoch
   */
  public long banUser(final long callerId, final UUID groupId, final long userId, @Nullable final String reason) {
    requireEnabled();

    final long epoch = database.inTransaction(handle -> {
      lockOpenGroup(handle, groupId);
      requireManager(handle, groupId, callerId);

      final Optional<GroupParticipant> target = groups.getParticipant(handle, groupId, userId);

      if (target.isPresent() && target.get().role() == GroupRole.OWNER) {
        throw new KeyServerException(ErrorCode.FORBIDDEN, "The owner cannot be banned");
      }

      final Instant now = clock.instant();

      groups.markBanned(handle, groupId, userId, now);
      groups.putBan(handle, new GroupBan(groupId, userId, callerId, reason, now));

      return groups.incrementEpoch(handle, groupId, now);
    });

    publishEpochChanged(groupId, epoch, REASON_MEMBER_BANNED);

    return epoch;
  }

  /**
   * Lifts a ban. The user is not re-admitted and the epoch does not change; rejoining takes a fresh add or invite.
   *
   * @return true if a ban was lifted
   */
  public boolean unbanUser(final long callerId, final UUID groupId, final long userId) {
    requireEnabled();

    return database.inTransaction(handle -> {
      lockOpenGroup(handle, groupId);
      requireManager(handle, groupId, callerId);

      final boolean lifted = groups.deleteBan(handle, groupId, userId);

      groups.getParticipant(handle, groupId, userId)
          .filter(participant -> !participant.isActive())
          .ifPresent(participant -> groups.deleteParticipant(handle, groupId, userId));

      return lifted;
    });
  }

  /**
   * Mutes the group for the caller until the given instant; a null instant unmutes.
   */
  public void muteGroup(final long callerId, final UUID groupId, @Nullable final Instant muteUntil) {
    requireEnabled();

    database.useTransaction(handle -> {
      groups.get(handle, groupId).orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));
      requireActiveMember(groups.getParticipant(handle, groupId, callerId));

      groups.setMuteUntil(handle, groupId, callerId, muteUntil);
    });
  }

  /**
   * Records sender-key rotation metadata for one of the caller's devices. The record must name the group's current
   * epoch.
   */
  public SenderKeyRecord recordSenderKey(final long callerId, final UUID groupId, final UUID deviceId,
      final String senderKeyId, final int chainIndex, final long groupEpoch) {

    requireEnabled();
    devicesManager.getActingDevice(callerId, deviceId);

    return database.inTransaction(handle -> {
      final Group group = groups.get(handle, groupId)
          .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));

      requireActiveMember(groups.getParticipant(handle, groupId, callerId));

      if (group.epoch() != groupEpoch) {
        throw KeyServerException.epochStale(group.epoch());
      }

      final SenderKeyRecord record =
          new SenderKeyRecord(groupId, callerId, deviceId, groupEpoch, senderKeyId, chainIndex, clock.instant());

      senderKeys.put(handle, record);

      return record;
    });
  }

  public List<SenderKeyRecord> listSenderKeys(final long callerId, final UUID groupId) {
    final Group group = getGroup(callerId, groupId);
    return senderKeys.getForEpoch(groupId, group.epoch());
  }

  /**
   * Admits a user to a locked, open group inside the caller's transaction and advances the epoch. Used by invite
   * redemption.
   *
   * @return the new epoch
   */
  long admit(final Handle handle, final UUID groupId, final long userId, final Optional<GroupParticipant> existing) {
    final Instant now = clock.instant();

    if (existing.isPresent()) {
      groups.reactivateParticipant(handle, groupId, userId, now);
    } else {
      groups.insertParticipant(handle, new GroupParticipant(groupId, userId, GroupRole.MEMBER, false, now, null));
    }

    return groups.incrementEpoch(handle, groupId, now);
  }

  Group lockOpenGroup(final Handle handle, final UUID groupId) {
    final Group group = groups.getForUpdate(handle, groupId)
        .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "Group not found"));

    if (group.closed()) {
      throw new KeyServerException(ErrorCode.GROUP_CLOSED, "Group is closed");
    }

    return group;
  }

  GroupParticipant requireManager(final Handle handle, final UUID groupId, final long callerId) {
    final GroupParticipant participant = requireActiveMember(groups.getParticipant(handle, groupId, callerId));

    if (!participant.role().canManageMembers()) {
      throw new KeyServerException(ErrorCode.FORBIDDEN, "Owner or admin role required");
    }

    return participant;
  }

  void requireEnabled() {
    if (!configuration.isEnabled()) {
      throw new KeyServerException(ErrorCode.DISABLED, "Groups are disabled");
    }
  }

  @VisibleForTesting
  void publishEpochChanged(final UUID groupId, final long epoch, final String reason) {
    Metrics.counter(EPOCH_CHANGED_COUNTER_NAME, "reason", reason).increment();

    try {
      eventPublisher.publish(LiveEvents.groupChannel(groupId), new LiveEvents.EpochChanged(groupId, epoch, reason));
    } catch (final RuntimeException e) {
      logger.warn("Failed to publish epoch change for group {}", groupId, e);
    }
  }

  private static GroupParticipant requireActiveMember(final Optional<GroupParticipant> participant) {
    return participant.filter(GroupParticipant::isActive)
        .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_MEMBER, "Not a member of this group"));
  }

  private GroupParticipant requireActiveTarget(final Handle handle, final UUID groupId, final long userId) {
    return groups.getParticipant(handle, groupId, userId)
        .filter(GroupParticipant::isActive)
        .orElseThrow(() -> new KeyServerException(ErrorCode.NOT_FOUND, "User is not a member"));
  }
}
