/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;
import org.jdbi.v3.core.Handle;
import org.whispersystems.keyserver.storage.mappers.GroupBanRowMapper;
import org.whispersystems.keyserver.storage.mappers.GroupParticipantRowMapper;
import org.whispersystems.keyserver.storage.mappers.GroupRowMapper;
import org.whispersystems.keyserver.storage.mappers.ResultSets;

/**
 * Groups, their participants and bans. Every membership mutation is expected to run inside a transaction that first
 * locks the group row with {@link #getForUpdate(Handle, UUID)}.
 */
public class Groups {

  public static final String ID                  = "id";
  public static final String TITLE               = "title";
  public static final String ABOUT               = "about";
  public static final String CREATED_BY          = "created_by";
  public static final String MAX_PARTICIPANTS    = "max_participants";
  public static final String EPOCH               = "group_epoch";
  public static final String ACTIVE_MEMBER_COUNT = "active_member_count";
  public static final String CLOSED              = "is_closed";
  public static final String CREATED_AT          = "created_at";
  public static final String UPDATED_AT          = "updated_at";
  public static final String EPOCH_CHANGED_AT    = "epoch_changed_at";
  public static final String LAST_MESSAGE_AT     = "last_message_at";

  public static final String PARTICIPANT_GROUP_ID   = "group_id";
  public static final String PARTICIPANT_USER_ID    = "user_id";
  public static final String PARTICIPANT_ROLE       = "role";
  public static final String PARTICIPANT_BANNED     = "is_banned";
  public static final String PARTICIPANT_JOINED_AT  = "joined_at";
  public static final String PARTICIPANT_MUTE_UNTIL = "mute_until";

  public static final String BAN_GROUP_ID  = "group_id";
  public static final String BAN_USER_ID   = "user_id";
  public static final String BAN_BANNED_BY = "banned_by";
  public static final String BAN_REASON    = "reason";
  public static final String BAN_BANNED_AT = "banned_at";

  private final FaultTolerantDatabase database;

  public Groups(FaultTolerantDatabase database) {
    this.database = database;
    this.database.getDatabase().registerRowMapper(new GroupRowMapper());
    this.database.getDatabase().registerRowMapper(new GroupParticipantRowMapper());
    this.database.getDatabase().registerRowMapper(new GroupBanRowMapper());
  }

  public void create(Handle handle, Group group, GroupParticipant owner) {
    handle.createUpdate("""
            INSERT INTO chat_groups (id, title, about, created_by, max_participants, group_epoch, active_member_count,
                                     is_closed, created_at, updated_at)
            VALUES (:id, :title, :about, :created_by, :max_participants, :group_epoch, :active_member_count,
                    :is_closed, :created_at, :updated_at)
            """)
        .bind(ID, group.id())
        .bind(TITLE, group.title())
        .bind(ABOUT, group.about())
        .bind(CREATED_BY, group.createdBy())
        .bind(MAX_PARTICIPANTS, group.maxParticipants())
        .bind(EPOCH, group.epoch())
        .bind(ACTIVE_MEMBER_COUNT, group.activeMemberCount())
        .bind(CLOSED, group.closed())
        .bind(CREATED_AT, group.createdAt().toEpochMilli())
        .bind(UPDATED_AT, group.updatedAt().toEpochMilli())
        .execute();

    insertParticipant(handle, owner);
  }

  public Optional<Group> get(Handle handle, UUID groupId) {
    return handle.createQuery("SELECT * FROM chat_groups WHERE id = :id")
        .bind("id", groupId)
        .mapTo(Group.class)
        .findOne();
  }

  public Optional<Group> get(UUID groupId) {
    return database.with(jdbi -> jdbi.withHandle(handle -> get(handle, groupId)));
  }

  /**
   * Reads the group and holds its row lock until the surrounding transaction ends. Concurrent membership changes to
   * the same group queue behind this lock; other groups are unaffected.
   */
  public Optional<Group> getForUpdate(Handle handle, UUID groupId) {
    return handle.createQuery("SELECT * FROM chat_groups WHERE id = :id FOR UPDATE")
        .bind("id", groupId)
        .mapTo(Group.class)
        .findOne();
  }

  public List<Group> getForMember(long userId, int limit, int offset) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("""
                SELECT g.* FROM chat_groups g
                JOIN group_participants p ON p.group_id = g.id
                WHERE p.user_id = :user_id AND p.is_banned = FALSE
                ORDER BY COALESCE(g.last_message_at, g.updated_at) DESC, g.id
                LIMIT :limit OFFSET :offset
                """)
            .bind("user_id", userId)
            .bind("limit", limit)
            .bind("offset", offset)
            .mapTo(Group.class)
            .list()));
  }

  public void updateDetails(Handle handle, UUID groupId, String title, @Nullable String about, Instant now) {
    handle.createUpdate("UPDATE chat_groups SET title = :title, about = :about, updated_at = :updated_at WHERE id = :id")
        .bind("id", groupId)
        .bind("title", title)
        .bind("about", about)
        .bind("updated_at", now.toEpochMilli())
        .execute();
  }

  public void close(Handle handle, UUID groupId, Instant now) {
    handle.createUpdate("UPDATE chat_groups SET is_closed = TRUE, updated_at = :updated_at WHERE id = :id")
        .bind("id", groupId)
        .bind("updated_at", now.toEpochMilli())
        .execute();
  }

  /**
   * Advances the group's epoch by one, refreshing the active member projection, and returns the new epoch.
   */
  public long incrementEpoch(Handle handle, UUID groupId, Instant now) {
    handle.createUpdate("""
            UPDATE chat_groups SET group_epoch = group_epoch + 1, epoch_changed_at = :now, updated_at = :now,
                                   active_member_count = (SELECT COUNT(*) FROM group_participants
                                                          WHERE group_id = :id AND is_banned = FALSE)
            WHERE id = :id
            """)
        .bind("id", groupId)
        .bind("now", now.toEpochMilli())
        .execute();

    return handle.createQuery("SELECT group_epoch FROM chat_groups WHERE id = :id")
        .bind("id", groupId)
        .mapTo(Long.class)
        .one();
  }

  public void setLastMessageAt(Handle handle, UUID groupId, Instant lastMessageAt) {
    handle.createUpdate("UPDATE chat_groups SET last_message_at = :last_message_at WHERE id = :id")
        .bind("id", groupId)
        .bind("last_message_at", lastMessageAt.toEpochMilli())
        .execute();
  }

  public int countActiveParticipants(Handle handle, UUID groupId) {
    return handle.createQuery("SELECT COUNT(*) FROM group_participants WHERE group_id = :group_id AND is_banned = FALSE")
        .bind("group_id", groupId)
        .mapTo(Integer.class)
        .one();
  }

  public Optional<GroupParticipant> getParticipant(Handle handle, UUID groupId, long userId) {
    return handle.createQuery("SELECT * FROM group_participants WHERE group_id = :group_id AND user_id = :user_id")
        .bind("group_id", groupId)
        .bind("user_id", userId)
        .mapTo(GroupParticipant.class)
        .findOne();
  }

  public Optional<GroupParticipant> getParticipant(UUID groupId, long userId) {
    return database.with(jdbi -> jdbi.withHandle(handle -> getParticipant(handle, groupId, userId)));
  }

  public List<GroupParticipant> getActiveParticipants(Handle handle, UUID groupId) {
    return handle.createQuery("""
            SELECT * FROM group_participants WHERE group_id = :group_id AND is_banned = FALSE
            ORDER BY joined_at, user_id
            """)
        .bind("group_id", groupId)
        .mapTo(GroupParticipant.class)
        .list();
  }

  public List<GroupParticipant> getActiveParticipants(UUID groupId) {
    return database.with(jdbi -> jdbi.withHandle(handle -> getActiveParticipants(handle, groupId)));
  }

  public void insertParticipant(Handle handle, GroupParticipant participant) {
    handle.createUpdate("""
            INSERT INTO group_participants (group_id, user_id, role, is_banned, joined_at, mute_until)
            VALUES (:group_id, :user_id, :role, :is_banned, :joined_at, :mute_until)
            """)
        .bind(PARTICIPANT_GROUP_ID, participant.groupId())
        .bind(PARTICIPANT_USER_ID, participant.userId())
        .bind(PARTICIPANT_ROLE, ResultSets.toColumnValue(participant.role()))
        .bind(PARTICIPANT_BANNED, participant.banned())
        .bind(PARTICIPANT_JOINED_AT, participant.joinedAt().toEpochMilli())
        .bind(PARTICIPANT_MUTE_UNTIL, ResultSets.toMillis(participant.muteUntil()))
        .execute();
  }

  /**
   * Turns a retained banned row back into an ordinary member row.
   */
  public void reactivateParticipant(Handle handle, UUID groupId, long userId, Instant now) {
    handle.createUpdate("""
            UPDATE group_participants SET is_banned = FALSE, role = :role, joined_at = :joined_at, mute_until = NULL
            WHERE group_id = :group_id AND user_id = :user_id
            """)
        .bind("group_id", groupId)
        .bind("user_id", userId)
        .bind("role", ResultSets.toColumnValue(GroupRole.MEMBER))
        .bind("joined_at", now.toEpochMilli())
        .execute();
  }

  public void deleteParticipant(Handle handle, UUID groupId, long userId) {
    handle.createUpdate("DELETE FROM group_participants WHERE group_id = :group_id AND user_id = :user_id")
        .bind("group_id", groupId)
        .bind("user_id", userId)
        .execute();
  }

  public void setRole(Handle handle, UUID groupId, long userId, GroupRole role) {
    handle.createUpdate("UPDATE group_participants SET role = :role WHERE group_id = :group_id AND user_id = :user_id")
        .bind("group_id", groupId)
        .bind("user_id", userId)
        .bind("role", ResultSets.toColumnValue(role))
        .execute();
  }

  public void setMuteUntil(Handle handle, UUID groupId, long userId, @Nullable Instant muteUntil) {
    handle.createUpdate("UPDATE group_participants SET mute_until = :mute_until WHERE group_id = :group_id AND user_id = :user_id")
        .bind("group_id", groupId)
        .bind("user_id", userId)
        .bind("mute_until", ResultSets.toMillis(muteUntil))
        .execute();
  }

  /**
   * Marks the user's participant row banned, creating a banned row if the user had none.
   */
  public void markBanned(Handle handle, UUID groupId, long userId, Instant now) {
    final int updated = handle.createUpdate("""
            UPDATE group_participants SET is_banned = TRUE, role = :role
            WHERE group_id = :group_id AND user_id = :user_id
            """)
        .bind("group_id", groupId)
        .bind("user_id", userId)
        .bind("role", ResultSets.toColumnValue(GroupRole.MEMBER))
        .execute();

    if (updated == 0) {
      insertParticipant(handle, new GroupParticipant(groupId, userId, GroupRole.MEMBER, true, now, null));
    }
  }

  public Optional<GroupBan> getBan(Handle handle, UUID groupId, long userId) {
    return handle.createQuery("SELECT * FROM group_bans WHERE group_id = :group_id AND user_id = :user_id")
        .bind("group_id", groupId)
        .bind("user_id", userId)
        .mapTo(GroupBan.class)
        .findOne();
  }

  /**
   * Records a ban, replacing any earlier ban of the same user. Callers hold the group lock, so the update-then-insert
   * cannot race with another writer for the same row.
   */
  public void putBan(Handle handle, GroupBan ban) {
    final int updated = handle.createUpdate("""
            UPDATE group_bans SET banned_by = :banned_by, reason = :reason, banned_at = :banned_at
            WHERE group_id = :group_id AND user_id = :user_id
            """)
        .bind(BAN_GROUP_ID, ban.groupId())
        .bind(BAN_USER_ID, ban.userId())
        .bind(BAN_BANNED_BY, ban.bannedBy())
        .bind(BAN_REASON, ban.reason())
        .bind(BAN_BANNED_AT, ban.bannedAt().toEpochMilli())
        .execute();

    if (updated == 0) {
      handle.createUpdate("""
              INSERT INTO group_bans (group_id, user_id, banned_by, reason, banned_at)
              VALUES (:group_id, :user_id, :banned_by, :reason, :banned_at)
              """)
          .bind(BAN_GROUP_ID, ban.groupId())
          .bind(BAN_USER_ID, ban.userId())
          .bind(BAN_BANNED_BY, ban.bannedBy())
          .bind(BAN_REASON, ban.reason())
          .bind(BAN_BANNED_AT, ban.bannedAt().toEpochMilli())
          .execute();
    }
  }

  public boolean deleteBan(Handle handle, UUID groupId, long userId) {
    return handle.createUpdate("DELETE FROM group_bans WHERE group_id = :group_id AND user_id = :user_id")
        .bind("group_id", groupId)
        .bind("user_id", userId)
        .execute() > 0;
  }

  /**
   * Returns true if both users are active participants of at least one open group.
   */
  public boolean shareOpenGroup(long firstUserId, long secondUserId) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("""
                SELECT COUNT(*) FROM group_participants a
                JOIN group_participants b ON b.group_id = a.group_id
                JOIN chat_groups g ON g.id = a.group_id
                WHERE a.user_id = :first_user_id AND b.user_id = :second_user_id
                  AND a.is_banned = FALSE AND b.is_banned = FALSE AND g.is_closed = FALSE
                """)
            .bind("first_user_id", firstUserId)
            .bind("second_user_id", secondUserId)
            .mapTo(Integer.class)
            .one() > 0));
  }
}
