/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import org.whispersystems.keyserver.identity.RelationshipDirectory;

/**
 * Reads the host application's {@code users} and {@code user_blocks} tables.
 */
public class HostRelationshipDirectory implements RelationshipDirectory {

  private final FaultTolerantDatabase database;

  public HostRelationshipDirectory(FaultTolerantDatabase database) {
    this.database = database;
  }

  @Override
  public boolean exists(long userId) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("SELECT COUNT(*) FROM users WHERE id = :id")
            .bind("id", userId)
            .mapTo(Integer.class)
            .one() > 0));
  }

  @Override
  public boolean isBlocked(long blockerId, long blockedId) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("SELECT COUNT(*) FROM user_blocks WHERE blocker_id = :blocker_id AND blocked_id = :blocked_id")
            .bind("blocker_id", blockerId)
            .bind("blocked_id", blockedId)
            .mapTo(Integer.class)
            .one() > 0));
  }

  @Override
  public boolean isOperator(long userId) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("SELECT COUNT(*) FROM users WHERE id = :id AND is_operator = TRUE")
            .bind("id", userId)
            .mapTo(Integer.class)
            .one() > 0));
  }
}
