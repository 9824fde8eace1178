/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.metrics;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import com.google.common.base.Suppliers;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.configuration.AggregateMetricsConfiguration;
import org.whispersystems.keyserver.configuration.KeysConfiguration;
import org.whispersystems.keyserver.entities.AggregateMetrics;
import org.whispersystems.keyserver.push.EventPublisher;
import org.whispersystems.keyserver.storage.Statistics;

/**
 * Composes the operator metrics view from read-only queries. The view is cached briefly; each section is computed
 * independently and reported as null if its source fails.
 */
public class MetricsAggregator {

  private static final Logger logger = LoggerFactory.getLogger(MetricsAggregator.class);

  private static final String SECTION_FAILURE_COUNTER_NAME = name(MetricsAggregator.class, "sectionFailure");

  private final Statistics statistics;
  private final EventPublisher eventPublisher;
  private final KeysConfiguration keysConfiguration;
  private final AggregateMetricsConfiguration configuration;
  private final Clock clock;

  private final Supplier<AggregateMetrics> cachedMetrics;

  public MetricsAggregator(final Statistics statistics,
      final EventPublisher eventPublisher,
      final KeysConfiguration keysConfiguration,
      final AggregateMetricsConfiguration configuration,
      final Clock clock) {

    this.statistics = statistics;
    this.eventPublisher = eventPublisher;
    this.keysConfiguration = keysConfiguration;
    this.configuration = configuration;
    this.clock = clock;

    this.cachedMetrics = Suppliers.memoizeWithExpiration(this::compute,
        configuration.getCacheDuration().toMillis(), TimeUnit.MILLISECONDS);
  }

  public AggregateMetrics getMetrics() {
    return cachedMetrics.get();
  }

  AggregateMetrics compute() {
    final Instant now = clock.instant();
    final Instant startOfDay = now.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();
    final Instant oneHourAgo = now.minus(Duration.ofHours(1));

    return new AggregateMetrics(now,
        section("connections", () -> eventPublisher.getConnectionStats()
            .map(stats -> new AggregateMetrics.Connections(true, stats.connectedUsers(), stats.subscriptions()))
            .orElseGet(() -> new AggregateMetrics.Connections(false, 0, 0))),
        section("prekeys", () -> statistics.getPreKeyStats(keysConfiguration.getLowWatermark(),
            keysConfiguration.getCriticalWatermark(), configuration.getSampleSize())),
        section("signedPreKeys", () -> statistics.getSignedPreKeyStats(now,
            keysConfiguration.getSignedPreKeyRotation(), keysConfiguration.getSignedPreKeyMaxAge())),
        section("messages", () -> statistics.getMessageVolume(startOfDay, oneHourAgo)),
        section("delivery", () -> statistics.getDeliveryStats(oneHourAgo)),
        section("devices", statistics::getDeviceCounts),
        section("groups", () -> statistics.getGroupStats(now.minus(Duration.ofDays(1)))));
  }

  @Nullable
  private static <T> T section(final String name, final Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (final RuntimeException e) {
      logger.warn("Failed to compute {} metrics", name, e);
      Metrics.counter(SECTION_FAILURE_COUNTER_NAME, "section", name).increment();

      return null;
    }
  }
}
