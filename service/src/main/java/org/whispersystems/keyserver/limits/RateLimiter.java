/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.limits;

import java.util.UUID;
import org.jdbi.v3.core.Handle;
import org.whispersystems.keyserver.controllers.RateLimitExceededException;

public interface RateLimiter {

  /**
   * Admits one more message from the sender into the thread, or throws if the window is full.
   */
  void validate(Handle handle, long senderUserId, UUID threadId) throws RateLimitExceededException;
}
