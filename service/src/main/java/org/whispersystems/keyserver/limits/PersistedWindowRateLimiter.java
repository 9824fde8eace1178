/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.limits;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;
import org.jdbi.v3.core.Handle;
import org.whispersystems.keyserver.configuration.SlidingWindowConfiguration;
import org.whispersystems.keyserver.controllers.RateLimitExceededException;
import org.whispersystems.keyserver.storage.WindowUsage;

/**
 * A sliding-window limiter that keeps no counters of its own: it counts already-persisted messages inside the trailing
 * window. The retry-after it reports is the time until enough messages age out of the window to admit one more.
 * <p>
 * Callers validate inside the transaction that stores the message, after locking the sender, so that concurrent sends
 * from one sender are counted one after another.
 */
public class PersistedWindowRateLimiter implements RateLimiter {

  @FunctionalInterface
  public interface UsageSource {

    /**
     * Counts the sender's messages created after {@code since}. When the count reaches {@code limit}, also returns the
     * creation time of the message whose expiry brings the count back below the limit.
     */
    WindowUsage getUsageSince(Handle handle, long senderUserId, UUID threadId, Instant since, int limit);
  }

  private final Supplier<SlidingWindowConfiguration> configResolver;
  private final UsageSource usageSource;
  private final Clock clock;
  private final Counter limitedCounter;

  public PersistedWindowRateLimiter(final String name,
      final Supplier<SlidingWindowConfiguration> configResolver,
      final UsageSource usageSource,
      final Clock clock) {

    this.configResolver = configResolver;
    this.usageSource = usageSource;
    this.clock = clock;
    this.limitedCounter = Metrics.counter(name(PersistedWindowRateLimiter.class, "limited"), "limiter", name);
  }

  @Override
  public void validate(final Handle handle, final long senderUserId, final UUID threadId)
      throws RateLimitExceededException {

    final SlidingWindowConfiguration config = configResolver.get();
    final Instant now = clock.instant();
    final WindowUsage usage =
        usageSource.getUsageSince(handle, senderUserId, threadId, now.minus(config.window()), config.limit());

    if (usage.count() < config.limit()) {
      return;
    }

    limitedCounter.increment();

    final Duration untilAdmitted = usage.limitingMessageCreatedAt()
        .map(createdAt -> Duration.between(now, createdAt.plus(config.window())))
        .orElse(config.window());

    throw new RateLimitExceededException(roundUpToSeconds(untilAdmitted), config.limit(), 0);
  }

  private static Duration roundUpToSeconds(final Duration duration) {
    final long seconds = (duration.toMillis() + 999) / 1000;
    return Duration.ofSeconds(Math.max(1, seconds));
  }
}
