/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.UUID;

/**
 * The published long-term key material of one device. Key fields hold base64-encoded public keys and signatures.
 */
public record KeyBundle(UUID deviceId,
                        String identityKey,
                        String signedPreKey,
                        String signedPreKeySignature,
                        long bundleVersion,
                        int prekeysRemaining,
                        Instant updatedAt) {
}
