/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * At most {@code limit} events per trailing {@code window}.
 */
public record SlidingWindowConfiguration(@Min(1) int limit, @NotNull Duration window) {
}
