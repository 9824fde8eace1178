/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.limits;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.jdbi.v3.core.Handle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.whispersystems.keyserver.configuration.SlidingWindowConfiguration;
import org.whispersystems.keyserver.controllers.RateLimitExceededException;
import org.whispersystems.keyserver.storage.WindowUsage;
import org.whispersystems.keyserver.util.TestClock;

class PersistedWindowRateLimiterTest {

  private static final long SENDER = 42;
  private static final UUID THREAD = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private final TestClock clock = TestClock.pinned(NOW);
  private final Handle handle = mock(Handle.class);
  private final AtomicReference<SlidingWindowConfiguration> config =
      new AtomicReference<>(new SlidingWindowConfiguration(5, Duration.ofSeconds(10)));

  private PersistedWindowRateLimiter.UsageSource usageSource;
  private PersistedWindowRateLimiter rateLimiter;

  @BeforeEach
  void setUp() {
    usageSource = mock(PersistedWindowRateLimiter.UsageSource.class);
    rateLimiter = new PersistedWindowRateLimiter("test", config::get, usageSource, clock);
  }

  @Test
  void admitsBelowLimit() {
    when(usageSource.getUsageSince(handle, SENDER, THREAD, NOW.minusSeconds(10), 5))
        .thenReturn(new WindowUsage(4, Optional.empty()));

    assertThatNoException().isThrownBy(() -> rateLimiter.validate(handle, SENDER, THREAD));
    verify(usageSource).getUsageSince(handle, SENDER, THREAD, NOW.minusSeconds(10), 5);
  }

  @Test
  void retryAfterLimitingMessageLeavesWindow() {
    when(usageSource.getUsageSince(eq(handle), eq(SENDER), eq(THREAD), eq(NOW.minusSeconds(10)), eq(5)))
        .thenReturn(new WindowUsage(5, Optional.of(NOW.minusMillis(3_500))));

    assertThatThrownBy(() -> rateLimiter.validate(handle, SENDER, THREAD))
        .isInstanceOfSatisfying(RateLimitExceededException.class, e -> {
          assertThat(e.getRetryDuration()).hasValue(Duration.ofSeconds(7));
          assertThat(e.getLimit()).isEqualTo(5);
          assertThat(e.getRemaining()).isZero();
        });
  }

  @Test
  void retryWaitsForEnoughMessagesToAgeOutWhenOverLimit() {
    // seven messages against a limit of five: the third oldest must leave the window, not the oldest
    when(usageSource.getUsageSince(eq(handle), eq(SENDER), eq(THREAD), eq(NOW.minusSeconds(10)), eq(5)))
        .thenReturn(new WindowUsage(7, Optional.of(NOW.minusSeconds(2))));

    assertThatThrownBy(() -> rateLimiter.validate(handle, SENDER, THREAD))
        .isInstanceOfSatisfying(RateLimitExceededException.class,
            e -> assertThat(e.getRetryDuration()).hasValue(Duration.ofSeconds(8)));
  }

  @Test
  void retryIsAtLeastOneSecond() {
    when(usageSource.getUsageSince(any(), anyLong(), eq(THREAD), eq(NOW.minusSeconds(10)), anyInt()))
        .thenReturn(new WindowUsage(7, Optional.of(NOW.minusSeconds(10).plusMillis(1))));

    assertThatThrownBy(() -> rateLimiter.validate(handle, SENDER, THREAD))
        .isInstanceOfSatisfying(RateLimitExceededException.class,
            e -> assertThat(e.getRetryDuration()).hasValue(Duration.ofSeconds(1)));
  }

  @Test
  void configurationIsResolvedOnEveryCheck() {
    config.set(new SlidingWindowConfiguration(2, Duration.ofSeconds(30)));

    when(usageSource.getUsageSince(handle, SENDER, THREAD, NOW.minusSeconds(30), 2))
        .thenReturn(new WindowUsage(2, Optional.of(NOW.minusSeconds(10))));

    assertThatThrownBy(() -> rateLimiter.validate(handle, SENDER, THREAD))
        .isInstanceOfSatisfying(RateLimitExceededException.class, e -> {
          assertThat(e.getRetryDuration()).hasValue(Duration.ofSeconds(20));
          assertThat(e.getLimit()).isEqualTo(2);
        });
  }

  @Test
  void rateLimitersCheckBothWindows() throws RateLimitExceededException {
    final RateLimiter messages = mock(RateLimiter.class);
    final RateLimiter burst = mock(RateLimiter.class);
    final RateLimiters rateLimiters = new RateLimiters(messages, burst);

    rateLimiters.validateSend(handle, SENDER, THREAD);

    verify(messages).validate(handle, SENDER, THREAD);
    verify(burst).validate(handle, SENDER, THREAD);

    final RateLimitExceededException exceeded = new RateLimitExceededException(Duration.ofSeconds(3), 30, 0);
    doThrow(exceeded).when(messages).validate(handle, SENDER, THREAD);

    final RateLimiter untouched = mock(RateLimiter.class);

    assertThatThrownBy(() -> new RateLimiters(messages, untouched).validateSend(handle, SENDER, THREAD))
        .isSameAs(exceeded);
    verifyNoInteractions(untouched);
  }
}
