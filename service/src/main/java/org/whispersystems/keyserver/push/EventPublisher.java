/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.push;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Best-effort fan-out of live events. Delivery is never guaranteed; clients recover missed events by polling.
 */
public interface EventPublisher {

  /**
   * Publishes the event to the channel. The returned stage completes exceptionally if the event could not be handed to
   * the transport; callers must not let such a failure affect already-committed work.
   */
  CompletionStage<Void> publish(String channel, Object event);

  /**
   * Returns live subscriber statistics if the transport can report them.
   */
  Optional<ConnectionStats> getConnectionStats();
}
