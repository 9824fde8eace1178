/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.annotations.VisibleForTesting;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

public class RateLimitsConfiguration {

  /**
   * Per-sender window across every conversation and group.
   */
  @JsonProperty
  @Valid
  @NotNull
  private SlidingWindowConfiguration messages = new SlidingWindowConfiguration(30, Duration.ofSeconds(60));

  /**
   * Per-sender window within a single conversation or group.
   */
  @JsonProperty
  @Valid
  @NotNull
  private SlidingWindowConfiguration conversationBurst = new SlidingWindowConfiguration(5, Duration.ofSeconds(10));

  public SlidingWindowConfiguration getMessages() {
    return messages;
  }

  public SlidingWindowConfiguration getConversationBurst() {
    return conversationBurst;
  }

  @VisibleForTesting
  public void setMessages(final SlidingWindowConfiguration messages) {
    this.messages = messages;
  }

  @VisibleForTesting
  public void setConversationBurst(final SlidingWindowConfiguration conversationBurst) {
    this.conversationBurst = conversationBurst;
  }
}
