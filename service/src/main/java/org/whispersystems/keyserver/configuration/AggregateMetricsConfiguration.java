/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

public class AggregateMetricsConfiguration {

  @JsonProperty
  @NotNull
  private Duration cacheDuration = Duration.ofSeconds(30);

  /**
   * Maximum number of device ids listed per watermark bucket.
   */
  @JsonProperty
  @Min(0)
  private int sampleSize = 10;

  public Duration getCacheDuration() {
    return cacheDuration;
  }

  public int getSampleSize() {
    return sampleSize;
  }
}
