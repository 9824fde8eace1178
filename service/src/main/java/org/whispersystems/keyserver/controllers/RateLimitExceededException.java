/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.controllers;

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

public class RateLimitExceededException extends Exception {

  @Nullable
  private final Duration retryDuration;

  private final int limit;
  private final int remaining;

  /**
   * Constructs a new exception indicating when it may become safe to retry
   *
   * @param retryDuration A duration to wait before retrying, null if no duration can be indicated
   * @param limit the number of events the violated window admits
   * @param remaining the number of events still admitted by the violated window
   */
  public RateLimitExceededException(@Nullable final Duration retryDuration, final int limit, final int remaining) {
    super(null, null, true, false);
    this.retryDuration = retryDuration;
    this.limit = limit;
    this.remaining = remaining;
  }

  public Optional<Duration> getRetryDuration() {
    return Optional.ofNullable(retryDuration);
  }

  public int getLimit() {
    return limit;
  }

  public int getRemaining() {
    return remaining;
  }
}
