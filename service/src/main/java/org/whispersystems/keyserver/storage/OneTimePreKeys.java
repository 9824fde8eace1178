/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.whispersystems.keyserver.storage.mappers.OneTimePreKeyRowMapper;

/**
 * Single-use prekeys. Claimed rows are kept for audit; only unclaimed rows are ever deleted.
 */
public class OneTimePreKeys {

  public static final String ID         = "id";
  public static final String DEVICE_ID  = "device_id";
  public static final String PUBLIC_KEY = "public_key";
  public static final String CLAIMED    = "claimed";

  private final FaultTolerantDatabase database;

  public OneTimePreKeys(FaultTolerantDatabase database) {
    this.database = database;
    this.database.getDatabase().registerRowMapper(new OneTimePreKeyRowMapper());
  }

  /**
   * Replaces the device's unclaimed prekeys with the given batch.
   */
  public void replaceUnclaimed(Handle handle, UUID deviceId, List<String> publicKeys, Instant now) {
    handle.createUpdate("DELETE FROM one_time_prekeys WHERE device_id = :device_id AND claimed = FALSE")
        .bind("device_id", deviceId)
        .execute();

    final PreparedBatch preparedBatch = handle.prepareBatch(
        "INSERT INTO one_time_prekeys (device_id, public_key, claimed, created_at) VALUES (:device_id, :public_key, FALSE, :created_at)");

    for (String publicKey : publicKeys) {
      preparedBatch.bind("device_id", deviceId)
                   .bind("public_key", publicKey)
                   .bind("created_at", now.toEpochMilli())
                   .add();
    }

    preparedBatch.execute();
  }

  /**
   * Claims a prekey if, and only if, it belongs to the device and is still unclaimed. Of any number of concurrent
   * callers racing on the same prekey, exactly one sees {@code true}.
   */
  public boolean claim(Handle handle, UUID deviceId, long prekeyId, long claimedBy, Instant now) {
    return handle.createUpdate("""
            UPDATE one_time_prekeys SET claimed = TRUE, claimed_by = :claimed_by, claimed_at = :claimed_at
            WHERE id = :id AND device_id = :device_id AND claimed = FALSE
            """)
        .bind("id", prekeyId)
        .bind("device_id", deviceId)
        .bind("claimed_by", claimedBy)
        .bind("claimed_at", now.toEpochMilli())
        .execute() == 1;
  }

  public Optional<OneTimePreKey> get(Handle handle, long prekeyId) {
    return handle.createQuery("SELECT * FROM one_time_prekeys WHERE id = :id")
        .bind("id", prekeyId)
        .mapTo(OneTimePreKey.class)
        .findOne();
  }

  public int countUnclaimed(Handle handle, UUID deviceId) {
    return handle.createQuery("SELECT COUNT(*) FROM one_time_prekeys WHERE device_id = :device_id AND claimed = FALSE")
        .bind("device_id", deviceId)
        .mapTo(Integer.class)
        .one();
  }

  public int countUnclaimed(UUID deviceId) {
    return database.with(jdbi -> jdbi.withHandle(handle -> countUnclaimed(handle, deviceId)));
  }

  /**
   * Returns the lowest-numbered unclaimed prekey without claiming it.
   */
  public Optional<OneTimePreKey> peekUnclaimed(UUID deviceId) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("SELECT * FROM one_time_prekeys WHERE device_id = :device_id AND claimed = FALSE ORDER BY id LIMIT 1")
            .bind("device_id", deviceId)
            .mapTo(OneTimePreKey.class)
            .findOne()));
  }
}
