/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;
import org.jdbi.v3.core.Handle;
import org.whispersystems.keyserver.storage.mappers.DeviceRowMapper;
import org.whispersystems.keyserver.storage.mappers.ResultSets;

/**
 * Device rows plus the append-only audit tables that track their trust lifecycle (identity-key changes and
 * revocations).
 */
public class Devices {

  public static final String ID           = "id";
  public static final String USER_ID      = "user_id";
  public static final String NAME         = "name";
  public static final String STATUS       = "status";
  public static final String CREATED_AT   = "created_at";
  public static final String LAST_SEEN_AT = "last_seen_at";

  private final FaultTolerantDatabase database;

  public Devices(FaultTolerantDatabase database) {
    this.database = database;
    this.database.getDatabase().registerRowMapper(new DeviceRowMapper());
  }

  public Optional<Device> get(UUID deviceId) {
    return database.with(jdbi -> jdbi.withHandle(handle -> get(handle, deviceId)));
  }

  public Optional<Device> get(Handle handle, UUID deviceId) {
    return handle.createQuery("SELECT * FROM devices WHERE id = :id")
        .bind("id", deviceId)
        .mapTo(Device.class)
        .findOne();
  }

  /**
   * Reads a device and holds its row lock until the surrounding transaction ends, serializing concurrent key uploads
   * for the same device.
   */
  public Optional<Device> getForUpdate(Handle handle, UUID deviceId) {
    return handle.createQuery("SELECT * FROM devices WHERE id = :id FOR UPDATE")
        .bind("id", deviceId)
        .mapTo(Device.class)
        .findOne();
  }

  public List<Device> getByOwner(long userId) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("SELECT * FROM devices WHERE user_id = :user_id ORDER BY created_at DESC, id")
            .bind("user_id", userId)
            .mapTo(Device.class)
            .list()));
  }

  public List<UUID> getActiveDeviceIds(Handle handle, long userId) {
    return handle.createQuery("SELECT id FROM devices WHERE user_id = :user_id AND status = :status ORDER BY created_at, id")
        .bind("user_id", userId)
        .bind("status", ResultSets.toColumnValue(DeviceStatus.ACTIVE))
        .mapTo(UUID.class)
        .list();
  }

  public void create(Handle handle, Device device) {
    handle.createUpdate("""
            INSERT INTO devices (id, user_id, name, status, created_at, last_seen_at)
            VALUES (:id, :user_id, :name, :status, :created_at, :last_seen_at)
            """)
        .bind("id", device.id())
        .bind("user_id", device.ownerUserId())
        .bind("name", device.name())
        .bind("status", ResultSets.toColumnValue(device.status()))
        .bind("created_at", device.createdAt().toEpochMilli())
        .bind("last_seen_at", ResultSets.toMillis(device.lastSeenAt()))
        .execute();
  }

  public void updateNameAndLastSeen(Handle handle, UUID deviceId, String name, Instant lastSeen) {
    handle.createUpdate("UPDATE devices SET name = :name, last_seen_at = :last_seen_at WHERE id = :id")
        .bind("id", deviceId)
        .bind("name", name)
        .bind("last_seen_at", lastSeen.toEpochMilli())
        .execute();
  }

  /**
   * Marks an active device revoked and records the revocation. Returns false, and writes nothing, if the device was
   * already revoked.
   */
  public boolean revoke(Handle handle, Device device, @Nullable String reason, Instant now) {
    final int updated = handle.createUpdate("UPDATE devices SET status = :revoked WHERE id = :id AND status = :active")
        .bind("id", device.id())
        .bind("revoked", ResultSets.toColumnValue(DeviceStatus.REVOKED))
        .bind("active", ResultSets.toColumnValue(DeviceStatus.ACTIVE))
        .execute();

    if (updated == 0) {
      return false;
    }

    handle.createUpdate("""
            INSERT INTO device_revocations (user_id, device_id, reason, created_at)
            VALUES (:user_id, :device_id, :reason, :created_at)
            """)
        .bind("user_id", device.ownerUserId())
        .bind("device_id", device.id())
        .bind("reason", reason)
        .bind("created_at", now.toEpochMilli())
        .execute();

    return true;
  }

  public void appendIdentityChangeEvent(Handle handle, Device device, IdentityChangeReason reason, Instant now) {
    handle.createUpdate("""
            INSERT INTO identity_change_events (user_id, device_id, reason, created_at)
            VALUES (:user_id, :device_id, :reason, :created_at)
            """)
        .bind("user_id", device.ownerUserId())
        .bind("device_id", device.id())
        .bind("reason", ResultSets.toColumnValue(reason))
        .bind("created_at", now.toEpochMilli())
        .execute();
  }

  public int countIdentityChangesSince(Handle handle, UUID deviceId, Instant since) {
    return handle.createQuery("""
            SELECT COUNT(*) FROM identity_change_events
            WHERE device_id = :device_id AND reason = :reason AND created_at > :since
            """)
        .bind("device_id", deviceId)
        .bind("reason", ResultSets.toColumnValue(IdentityChangeReason.IDENTITY_CHANGE))
        .bind("since", since.toEpochMilli())
        .mapTo(Integer.class)
        .one();
  }
}
