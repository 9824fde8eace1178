/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.util.UUID;

public record UploadKeyBundleResponse(UUID deviceId, long bundleVersion, int prekeysStored) {
}
