/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.push;

/**
 * @param connectedUsers number of user channels with at least one subscriber
 * @param subscriptions  total subscriptions across those channels
 */
public record ConnectionStats(int connectedUsers, long subscriptions) {
}
