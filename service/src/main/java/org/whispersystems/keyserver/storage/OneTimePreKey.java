/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.util.UUID;

public record OneTimePreKey(long id, UUID deviceId, String publicKey, boolean claimed) {
}
