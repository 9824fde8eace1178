/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.redis;

import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import java.time.Duration;
import java.util.function.Function;
import org.whispersystems.keyserver.configuration.RedisConfiguration;

/**
 * A single-node Redis client behind a circuit breaker. The connection is opened on first use and reopened after a
 * failed attempt, so the server starts and serves requests while Redis is unreachable.
 */
public class FaultTolerantRedisClient {

  private final String name;

  private final RedisClient redisClient;

  private volatile StatefulRedisConnection<String, String> stringConnection;

  private final CircuitBreaker circuitBreaker;

  public FaultTolerantRedisClient(final String name, final RedisConfiguration redisConfiguration) {
    this(name,
        RedisURI.create(redisConfiguration.getUri()),
        redisConfiguration.getTimeout(),
        CircuitBreaker.of(name, redisConfiguration.getCircuitBreakerConfiguration()
            .toCircuitBreakerConfig(throwable -> false)));
  }

  @VisibleForTesting
  FaultTolerantRedisClient(final String name,
                           final RedisURI redisUri,
                           final Duration commandTimeout,
                           final CircuitBreaker circuitBreaker) {

    this.name = name;

    redisUri.setTimeout(commandTimeout);

    this.redisClient = RedisClient.create(redisUri);
    this.redisClient.setOptions(ClientOptions.builder()
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        // for asynchronous commands
        .timeoutOptions(TimeoutOptions.builder()
            .fixedTimeout(commandTimeout)
            .build())
        .build());

    this.circuitBreaker = circuitBreaker;
  }

  public void shutdown() {
    synchronized (this) {
      if (stringConnection != null) {
        stringConnection.close();
      }
    }

    redisClient.shutdown();
  }

  public String getName() {
    return name;
  }

  public <T> T withConnection(final Function<StatefulRedisConnection<String, String>, T> function) {
    try {
      return circuitBreaker.executeCallable(() -> function.apply(getStringConnection()));
    } catch (final Throwable t) {
      if (t instanceof RedisException) {
        throw (RedisException) t;
      } else {
        throw new RedisException(t);
      }
    }
  }

  @VisibleForTesting
  boolean isConnected() {
    return stringConnection != null;
  }

  private StatefulRedisConnection<String, String> getStringConnection() {
    StatefulRedisConnection<String, String> connection = stringConnection;

    if (connection == null) {
      synchronized (this) {
        connection = stringConnection;

        if (connection == null) {
          connection = redisClient.connect();
          stringConnection = connection;
        }
      }
    }

    return connection;
  }
}
