/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.push;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.dropwizard.lifecycle.Managed;
import io.lettuce.core.RedisException;
import io.micrometer.core.instrument.Metrics;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.redis.FaultTolerantRedisClient;
import org.whispersystems.keyserver.util.SystemMapper;

/**
 * Publishes live events as JSON over Redis pub/sub.
 */
public class RedisEventPublisher implements EventPublisher, Managed {

  private static final Logger logger = LoggerFactory.getLogger(RedisEventPublisher.class);

  private static final String PUBLISH_COUNTER_NAME = name(RedisEventPublisher.class, "publish");

  private final FaultTolerantRedisClient redisClient;

  public RedisEventPublisher(final FaultTolerantRedisClient redisClient) {
    this.redisClient = redisClient;
  }

  @Override
  public void start() {
  }

  @Override
  public void stop() {
    redisClient.shutdown();
  }

  @Override
  public CompletionStage<Void> publish(final String channel, final Object event) {
    final String payload;

    try {
      payload = SystemMapper.jsonMapper().writeValueAsString(event);
    } catch (final JsonProcessingException e) {
      logger.warn("Failed to serialize event for {}", channel, e);
      Metrics.counter(PUBLISH_COUNTER_NAME, "outcome", "serializationFailure").increment();

      return CompletableFuture.failedFuture(e);
    }

    try {
      return redisClient.withConnection(connection -> connection.async().publish(channel, payload))
          .whenComplete((receivers, throwable) -> {
            if (throwable != null) {
              logger.warn("Failed to publish event to {}", channel, throwable);
              Metrics.counter(PUBLISH_COUNTER_NAME, "outcome", "failure").increment();
            } else {
              Metrics.counter(PUBLISH_COUNTER_NAME, "outcome", "success").increment();
            }
          })
          .thenAccept(receivers -> logger.debug("Published event to {} ({} receivers)", channel, receivers));
    } catch (final RedisException e) {
      logger.warn("Failed to publish event to {}", channel, e);
      Metrics.counter(PUBLISH_COUNTER_NAME, "outcome", "failure").increment();

      return CompletableFuture.failedFuture(e);
    }
  }

  @Override
  public Optional<ConnectionStats> getConnectionStats() {
    try {
      return Optional.of(redisClient.withConnection(connection -> {
        final List<String> channels = connection.sync().pubsubChannels(LiveEvents.USER_CHANNEL_PREFIX + "*");

        if (channels.isEmpty()) {
          return new ConnectionStats(0, 0);
        }

        final Map<String, Long> subscribers = connection.sync().pubsubNumsub(channels.toArray(new String[0]));

        return new ConnectionStats(channels.size(), subscribers.values().stream().mapToLong(Long::longValue).sum());
      }));
    } catch (final RedisException e) {
      logger.debug("Failed to read subscriber statistics", e);
      return Optional.empty();
    }
  }
}
