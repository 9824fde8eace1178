/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.time.Instant;
import java.util.List;
import javax.annotation.Nullable;

public record GroupMembersResponse(List<Member> members) {

  public record Member(long userId, String role, Instant joinedAt, @Nullable Instant muteUntil) {
  }
}
