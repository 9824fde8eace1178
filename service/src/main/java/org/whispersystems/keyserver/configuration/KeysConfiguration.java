/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.annotations.VisibleForTesting;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

public class KeysConfiguration {

  @JsonProperty
  private boolean enabled = true;

  @JsonProperty
  @Min(1)
  private int prekeyPoolSize = 100;

  @JsonProperty
  @Min(0)
  private int lowWatermark = 5;

  @JsonProperty
  @Min(0)
  private int criticalWatermark = 2;

  @JsonProperty
  @NotNull
  private Duration signedPreKeyRotation = Duration.ofDays(7);

  @JsonProperty
  @NotNull
  private Duration signedPreKeyMaxAge = Duration.ofDays(30);

  /**
   * Number of identity-key changes inside the window at which a device is flagged in the audit log.
   */
  @JsonProperty
  @Min(1)
  private int identityChangeAlertThreshold = 3;

  /**
   * Number of identity-key changes inside the window at which a device is revoked.
   */
  @JsonProperty
  @Min(1)
  private int identityChangeBlockThreshold = 5;

  @JsonProperty
  @NotNull
  private Duration identityChangeWindow = Duration.ofHours(24);

  public boolean isEnabled() {
    return enabled;
  }

  public int getPrekeyPoolSize() {
    return prekeyPoolSize;
  }

  public int getLowWatermark() {
    return lowWatermark;
  }

  public int getCriticalWatermark() {
    return criticalWatermark;
  }

  public Duration getSignedPreKeyRotation() {
    return signedPreKeyRotation;
  }

  public Duration getSignedPreKeyMaxAge() {
    return signedPreKeyMaxAge;
  }

  public int getIdentityChangeAlertThreshold() {
    return identityChangeAlertThreshold;
  }

  public int getIdentityChangeBlockThreshold() {
    return identityChangeBlockThreshold;
  }

  public Duration getIdentityChangeWindow() {
    return identityChangeWindow;
  }

  @VisibleForTesting
  public void setEnabled(final boolean enabled) {
    this.enabled = enabled;
  }

  @VisibleForTesting
  public void setPrekeyPoolSize(final int prekeyPoolSize) {
    this.prekeyPoolSize = prekeyPoolSize;
  }

  @VisibleForTesting
  public void setIdentityChangeAlertThreshold(final int identityChangeAlertThreshold) {
    this.identityChangeAlertThreshold = identityChangeAlertThreshold;
  }

  @VisibleForTesting
  public void setIdentityChangeBlockThreshold(final int identityChangeBlockThreshold) {
    this.identityChangeBlockThreshold = identityChangeBlockThreshold;
  }
}
