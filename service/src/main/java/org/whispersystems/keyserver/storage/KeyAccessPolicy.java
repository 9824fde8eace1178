/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import org.whispersystems.keyserver.controllers.ErrorCode;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.identity.RelationshipDirectory;

/**
 * Decides whether one user may read another user's key material. Unsolicited key harvesting is prevented by requiring
 * an existing conversation or a shared open group.
 */
public class KeyAccessPolicy {

  private final RelationshipDirectory relationshipDirectory;
  private final Conversations conversations;
  private final Groups groups;

  public KeyAccessPolicy(final RelationshipDirectory relationshipDirectory,
      final Conversations conversations,
      final Groups groups) {

    this.relationshipDirectory = relationshipDirectory;
    this.conversations = conversations;
    this.groups = groups;
  }

  public void checkAccess(final long callerId, final long targetUserId) {
    if (relationshipDirectory.isBlockedEitherWay(callerId, targetUserId)) {
      throw new KeyServerException(ErrorCode.BLOCKED, "Blocked");
    }

    if (callerId != targetUserId && !hasRelationship(callerId, targetUserId)) {
      throw new KeyServerException(ErrorCode.RELATIONSHIP_REQUIRED,
          "A conversation or shared group is required before fetching keys");
    }
  }

  private boolean hasRelationship(final long callerId, final long targetUserId) {
    return conversations.existsBetween(callerId, targetUserId) || groups.shareOpenGroup(callerId, targetUserId);
  }
}
