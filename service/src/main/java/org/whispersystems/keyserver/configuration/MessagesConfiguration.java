/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.annotations.VisibleForTesting;
import jakarta.validation.constraints.Min;

public class MessagesConfiguration {

  @JsonProperty
  private boolean enabled = true;

  /**
   * Ceiling on the decoded ciphertext size of a single message.
   */
  @JsonProperty
  @Min(1)
  private int maxCiphertextBytes = 64 * 1024;

  @JsonProperty
  @Min(1)
  private int defaultPageSize = 50;

  @JsonProperty
  @Min(1)
  private int maxPageSize = 200;

  public boolean isEnabled() {
    return enabled;
  }

  public int getMaxCiphertextBytes() {
    return maxCiphertextBytes;
  }

  public int getDefaultPageSize() {
    return defaultPageSize;
  }

  public int getMaxPageSize() {
    return maxPageSize;
  }

  @VisibleForTesting
  public void setEnabled(final boolean enabled) {
    this.enabled = enabled;
  }

  @VisibleForTesting
  public void setMaxCiphertextBytes(final int maxCiphertextBytes) {
    this.maxCiphertextBytes = maxCiphertextBytes;
  }
}
