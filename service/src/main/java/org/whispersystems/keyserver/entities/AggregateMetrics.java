/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Operator view of the key server's health. A section is null if it could not be computed.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record AggregateMetrics(Instant generatedAt,
                               @Nullable Connections connections,
                               @Nullable PreKeys prekeys,
                               @Nullable SignedPreKeys signedPreKeys,
                               @Nullable MessageVolume messages,
                               @Nullable Delivery delivery,
                               @Nullable DeviceCounts devices,
                               @Nullable GroupStats groups) {

  public record Connections(boolean publisherAvailable, int connectedUsers, long subscriptions) {
  }

  public record DevicePool(UUID deviceId, long userId, int available) {
  }

  public record PreKeys(int devicesWithBundles, long availablePreKeys, long claimedPreKeys, int devicesBelowLow,
                        int devicesBelowCritical, int lowWatermark, int criticalWatermark,
                        List<DevicePool> lowSamples, List<DevicePool> criticalSamples) {
  }

  public record SignedPreKeys(int rotationDue, int stale, long rotationAfterSeconds, long staleAfterSeconds) {
  }

  public record MessageVolume(long today, long lastHour, long conversationLastHour, long groupLastHour) {
  }

  public record Delivery(long undelivered, long unread, @Nullable Double averageLatencyMillis,
                         @Nullable Long maxLatencyMillis) {
  }

  public record DeviceCounts(int active, int revoked) {
  }

  public record GroupStats(int total, int open, int closed, double averageActiveMembers, long senderKeyEntries,
                           int rekeyedLast24Hours) {
  }
}
