/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.Optional;

/**
 * Number of messages inside a trailing window. If the window is full, also the creation time of the message whose
 * expiry admits the next one.
 */
public record WindowUsage(int count, Optional<Instant> limitingMessageCreatedAt) {
}
