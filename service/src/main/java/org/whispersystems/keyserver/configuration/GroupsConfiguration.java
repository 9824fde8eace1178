/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.annotations.VisibleForTesting;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

public class GroupsConfiguration {

  @JsonProperty
  private boolean enabled = true;

  @JsonProperty
  @Min(2)
  private int maxParticipants = 100;

  @JsonProperty
  @NotNull
  private Duration inviteExpiry = Duration.ofHours(168);

  @JsonProperty
  @Min(6)
  @Max(32)
  private int inviteCodeLength = 12;

  @JsonProperty
  @Min(1)
  private int inviteCodeAttempts = 5;

  public boolean isEnabled() {
    return enabled;
  }

  public int getMaxParticipants() {
    return maxParticipants;
  }

  public Duration getInviteExpiry() {
    return inviteExpiry;
  }

  public int getInviteCodeLength() {
    return inviteCodeLength;
  }

  public int getInviteCodeAttempts() {
    return inviteCodeAttempts;
  }

  @VisibleForTesting
  public void setEnabled(final boolean enabled) {
    this.enabled = enabled;
  }

  @VisibleForTesting
  public void setMaxParticipants(final int maxParticipants) {
    this.maxParticipants = maxParticipants;
  }
}
