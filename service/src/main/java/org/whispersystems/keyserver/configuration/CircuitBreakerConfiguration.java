/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.function.Predicate;

public class CircuitBreakerConfiguration {

  @JsonProperty
  @NotNull
  @Min(1)
  @Max(100)
  private int failureRateThreshold = 50;

  @JsonProperty
  @NotNull
  @Min(1)
  private int permittedNumberOfCallsInHalfOpenState = 10;

  @JsonProperty
  @NotNull
  @Min(1)
  private int slidingWindowSize = 100;

  @JsonProperty
  @NotNull
  @Min(1)
  private int slidingWindowMinimumNumberOfCalls = 100;

  @JsonProperty
  @NotNull
  private Duration waitDurationInOpenState = Duration.ofSeconds(10);

  public int getFailureRateThreshold() {
    return failureRateThreshold;
  }

  public int getPermittedNumberOfCallsInHalfOpenState() {
    return permittedNumberOfCallsInHalfOpenState;
  }

  public int getSlidingWindowSize() {
    return slidingWindowSize;
  }

  public int getSlidingWindowMinimumNumberOfCalls() {
    return slidingWindowMinimumNumberOfCalls;
  }

  public Duration getWaitDurationInOpenState() {
    return waitDurationInOpenState;
  }

  /**
   * Builds a breaker configuration that does not count failures matched by {@code ignored}; request-level failures
   * (a full group, a stale bundle) say nothing about the health of the store and must never open the breaker.
   */
  public CircuitBreakerConfig toCircuitBreakerConfig(final Predicate<Throwable> ignored) {
    return CircuitBreakerConfig.custom()
        .failureRateThreshold(getFailureRateThreshold())
        .ignoreException(ignored)
        .permittedNumberOfCallsInHalfOpenState(getPermittedNumberOfCallsInHalfOpenState())
        .waitDurationInOpenState(getWaitDurationInOpenState())
        .slidingWindow(getSlidingWindowSize(), getSlidingWindowMinimumNumberOfCalls(),
            CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
        .build();
  }
}
