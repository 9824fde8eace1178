/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.whispersystems.keyserver.configuration.AggregateMetricsConfiguration;
import org.whispersystems.keyserver.configuration.CallerAuthConfiguration;
import org.whispersystems.keyserver.configuration.CircuitBreakerConfiguration;
import org.whispersystems.keyserver.configuration.GroupsConfiguration;
import org.whispersystems.keyserver.configuration.KeysConfiguration;
import org.whispersystems.keyserver.configuration.MessagesConfiguration;
import org.whispersystems.keyserver.configuration.RateLimitsConfiguration;
import org.whispersystems.keyserver.configuration.RedisConfiguration;

public class KeyServerConfiguration extends Configuration {

  @NotNull
  @Valid
  @JsonProperty
  private DataSourceFactory database = new DataSourceFactory();

  @NotNull
  @Valid
  @JsonProperty
  private CircuitBreakerConfiguration databaseCircuitBreaker = new CircuitBreakerConfiguration();

  @NotNull
  @Valid
  @JsonProperty
  private CallerAuthConfiguration callerAuth;

  @NotNull
  @Valid
  @JsonProperty
  private KeysConfiguration keys = new KeysConfiguration();

  @NotNull
  @Valid
  @JsonProperty
  private MessagesConfiguration messages = new MessagesConfiguration();

  @NotNull
  @Valid
  @JsonProperty
  private RateLimitsConfiguration rateLimits = new RateLimitsConfiguration();

  @NotNull
  @Valid
  @JsonProperty
  private GroupsConfiguration groups = new GroupsConfiguration();

  @NotNull
  @Valid
  @JsonProperty
  private RedisConfiguration redis;

  @NotNull
  @Valid
  @JsonProperty
  private AggregateMetricsConfiguration aggregateMetrics = new AggregateMetricsConfiguration();

  public DataSourceFactory getDataSourceFactory() {
    return database;
  }

  public CircuitBreakerConfiguration getDatabaseCircuitBreakerConfiguration() {
    return databaseCircuitBreaker;
  }

  public CallerAuthConfiguration getCallerAuthConfiguration() {
    return callerAuth;
  }

  public KeysConfiguration getKeysConfiguration() {
    return keys;
  }

  public MessagesConfiguration getMessagesConfiguration() {
    return messages;
  }

  public RateLimitsConfiguration getRateLimitsConfiguration() {
    return rateLimits;
  }

  public GroupsConfiguration getGroupsConfiguration() {
    return groups;
  }

  public RedisConfiguration getRedisConfiguration() {
    return redis;
  }

  public AggregateMetricsConfiguration getAggregateMetricsConfiguration() {
    return aggregateMetrics;
  }
}
