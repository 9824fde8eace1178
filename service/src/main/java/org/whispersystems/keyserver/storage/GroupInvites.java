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
import org.whispersystems.keyserver.storage.mappers.GroupInviteRowMapper;
import org.whispersystems.keyserver.storage.mappers.ResultSets;

public class GroupInvites {

  public static final String ID             = "id";
  public static final String GROUP_ID       = "group_id";
  public static final String CREATED_BY     = "created_by";
  public static final String TYPE           = "type";
  public static final String CODE           = "code";
  public static final String EXPIRES_AT     = "expires_at";
  public static final String MAX_USES       = "max_uses";
  public static final String USES           = "uses";
  public static final String TARGET_USER_ID = "target_user_id";
  public static final String CREATED_AT     = "created_at";

  private final FaultTolerantDatabase database;

  public GroupInvites(FaultTolerantDatabase database) {
    this.database = database;
    this.database.getDatabase().registerRowMapper(new GroupInviteRowMapper());
  }

  /**
   * Inserts an invite. Fails with a unique-constraint violation if the code is taken.
   */
  public void insert(Handle handle, GroupInvite invite) {
    handle.createUpdate("""
            INSERT INTO group_invites (id, group_id, created_by, type, code, expires_at, max_uses, uses,
                                       target_user_id, created_at)
            VALUES (:id, :group_id, :created_by, :type, :code, :expires_at, :max_uses, :uses,
                    :target_user_id, :created_at)
            """)
        .bind(ID, invite.id())
        .bind(GROUP_ID, invite.groupId())
        .bind(CREATED_BY, invite.createdBy())
        .bind(TYPE, ResultSets.toColumnValue(invite.type()))
        .bind(CODE, invite.code())
        .bind(EXPIRES_AT, invite.expiresAt().toEpochMilli())
        .bind(MAX_USES, invite.maxUses())
        .bind(USES, invite.uses())
        .bind(TARGET_USER_ID, invite.targetUserId())
        .bind(CREATED_AT, invite.createdAt().toEpochMilli())
        .execute();
  }

  public Optional<GroupInvite> getByCode(String code) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("SELECT * FROM group_invites WHERE code = :code")
            .bind("code", code)
            .mapTo(GroupInvite.class)
            .findOne()));
  }

  public Optional<GroupInvite> get(Handle handle, UUID inviteId) {
    return handle.createQuery("SELECT * FROM group_invites WHERE id = :id")
        .bind("id", inviteId)
        .mapTo(GroupInvite.class)
        .findOne();
  }

  /**
   * Returns the group's invites that are neither expired nor used up.
   */
  public List<GroupInvite> getActive(UUID groupId, Instant now) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("""
                SELECT * FROM group_invites
                WHERE group_id = :group_id AND expires_at > :now AND (max_uses IS NULL OR uses < max_uses)
                ORDER BY created_at DESC, id
                """)
            .bind("group_id", groupId)
            .bind("now", now.toEpochMilli())
            .mapTo(GroupInvite.class)
            .list()));
  }

  public void incrementUses(Handle handle, UUID inviteId) {
    handle.createUpdate("UPDATE group_invites SET uses = uses + 1 WHERE id = :id")
        .bind("id", inviteId)
        .execute();
  }

  public void delete(Handle handle, UUID inviteId) {
    handle.createUpdate("DELETE FROM group_invites WHERE id = :id")
        .bind("id", inviteId)
        .execute();
  }
}
