/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.identity;

/**
 * The host application's view of users and the blocks between them.
 */
public interface RelationshipDirectory {

  boolean exists(long userId);

  /**
   * Returns true if {@code blockerId} has blocked {@code blockedId}.
   */
  boolean isBlocked(long blockerId, long blockedId);

  boolean isOperator(long userId);

  /**
   * Returns true if either user has blocked the other.
   */
  default boolean isBlockedEitherWay(final long firstUserId, final long secondUserId) {
    return isBlocked(firstUserId, secondUserId) || isBlocked(secondUserId, firstUserId);
  }
}
