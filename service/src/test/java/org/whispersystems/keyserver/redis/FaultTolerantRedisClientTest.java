/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.redis;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.whispersystems.keyserver.configuration.CircuitBreakerConfiguration;
import org.whispersystems.keyserver.push.LiveEvents;
import org.whispersystems.keyserver.push.RedisEventPublisher;

@Timeout(value = 15, threadMode = Timeout.ThreadMode.SEPARATE_THREAD)
class FaultTolerantRedisClientTest {

  // no listener on port 1
  private static final RedisURI UNREACHABLE = RedisURI.create("redis://127.0.0.1:1");

  private FaultTolerantRedisClient redisClient;

  @BeforeEach
  void setUp() {
    redisClient = new FaultTolerantRedisClient("test", UNREACHABLE, Duration.ofMillis(500),
        CircuitBreaker.of("test", new CircuitBreakerConfiguration().toCircuitBreakerConfig(throwable -> false)));
  }

  @AfterEach
  void tearDown() {
    redisClient.shutdown();
  }

  @Test
  void constructionDoesNotConnect() {
    assertFalse(redisClient.isConnected());
  }

  @Test
  void unreachableServerFailsEachCallWithRedisException() {
    assertThrows(RedisException.class, () -> redisClient.withConnection(connection -> connection.sync().ping()));
    assertFalse(redisClient.isConnected());

    // the next call tries to connect again rather than reusing a failed attempt
    assertThrows(RedisException.class, () -> redisClient.withConnection(connection -> connection.sync().ping()));
  }

  @Test
  void publishingWithoutRedisFailsTheReturnedStage() {
    final RedisEventPublisher eventPublisher = new RedisEventPublisher(redisClient);

    final CompletionException completionException = assertThrows(CompletionException.class,
        () -> eventPublisher.publish(LiveEvents.userChannel(7), new LiveEvents.ReceiptUpdated(UUID.randomUUID(), 7, "read", Instant.now()))
            .toCompletableFuture()
            .join());

    assertInstanceOf(RedisException.class, completionException.getCause());
    assertTrue(eventPublisher.getConnectionStats().isEmpty());
  }
}
