/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Clock class specialized for testing.
 * <p>
 * This clock can be pinned to a particular instant or can provide the "normal" time. It can also be advanced while
 * pinned, which lets tests step through expiry and sliding-window boundaries.
 */
public class TestClock extends Clock {

  private volatile Optional<Instant> pinnedInstant;
  private final ZoneId zoneId;

  private TestClock(Optional<Instant> maybePinned, ZoneId id) {
    this.pinnedInstant = maybePinned;
    this.zoneId = id;
  }

  /**
   * Instantiate a test clock that returns the "real" time.
   */
  public static TestClock now() {
    return new TestClock(Optional.empty(), ZoneId.of("UTC"));
  }

  /**
   * Instantiate a test clock pinned to a particular instant.
   */
  public static TestClock pinned(Instant instant) {
    return new TestClock(Optional.of(instant), ZoneId.of("UTC"));
  }

  public void pin(Instant instant) {
    this.pinnedInstant = Optional.of(instant);
  }

  public void unpin() {
    this.pinnedInstant = Optional.empty();
  }

  /**
   * Moves a pinned clock forward by the given amount.
   *
   * @throws IllegalStateException if the clock is not pinned
   */
  public void advance(Duration duration) {
    this.pinnedInstant = Optional.of(pinnedInstant
        .orElseThrow(() -> new IllegalStateException("Only a pinned clock can be advanced"))
        .plus(duration));
  }

  @Override
  public TestClock withZone(ZoneId id) {
    return new TestClock(pinnedInstant, id);
  }

  @Override
  public ZoneId getZone() {
    return zoneId;
  }

  @Override
  public Instant instant() {
    return pinnedInstant.orElseGet(Instant::now);
  }
}
