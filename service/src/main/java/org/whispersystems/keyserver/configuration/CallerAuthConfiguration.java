/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

public class CallerAuthConfiguration {

  /**
   * Hex-encoded HMAC-SHA256 key shared with the host application, which issues caller tokens.
   */
  @JsonProperty
  @NotBlank
  private String tokenKey;

  @JsonProperty
  @NotNull
  private Duration tokenLifetime = Duration.ofDays(1);

  public String getTokenKey() {
    return tokenKey;
  }

  public Duration getTokenLifetime() {
    return tokenLifetime;
  }
}
