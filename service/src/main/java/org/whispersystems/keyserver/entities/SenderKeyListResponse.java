/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import java.util.List;

public record SenderKeyListResponse(long epoch, List<SenderKeyResponse> senderKeys) {
}
