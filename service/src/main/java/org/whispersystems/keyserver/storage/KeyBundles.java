/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.Update;
import org.whispersystems.keyserver.storage.mappers.DeviceRowMapper;
import org.whispersystems.keyserver.storage.mappers.KeyBundleRowMapper;
import org.whispersystems.keyserver.storage.mappers.ResultSets;

public class KeyBundles {

  public static final String DEVICE_ID               = "device_id";
  public static final String IDENTITY_KEY            = "identity_key";
  public static final String SIGNED_PREKEY           = "signed_prekey";
  public static final String SIGNED_PREKEY_SIGNATURE = "signed_prekey_signature";
  public static final String BUNDLE_VERSION          = "bundle_version";
  public static final String PREKEYS_REMAINING       = "prekeys_remaining";
  public static final String UPDATED_AT              = "updated_at";

  private static final DeviceRowMapper    DEVICE_ROW_MAPPER     = new DeviceRowMapper();
  private static final KeyBundleRowMapper KEY_BUNDLE_ROW_MAPPER = new KeyBundleRowMapper();

  private final FaultTolerantDatabase database;

  public KeyBundles(FaultTolerantDatabase database) {
    this.database = database;
    this.database.getDatabase().registerRowMapper(KEY_BUNDLE_ROW_MAPPER);
  }

  public Optional<KeyBundle> get(Handle handle, UUID deviceId) {
    return handle.createQuery("SELECT * FROM key_bundles WHERE device_id = :device_id")
        .bind("device_id", deviceId)
        .mapTo(KeyBundle.class)
        .findOne();
  }

  public Optional<KeyBundle> get(UUID deviceId) {
    return database.with(jdbi -> jdbi.withHandle(handle -> get(handle, deviceId)));
  }

  /**
   * Locks the bundle row; prekey claims take this lock first so the remaining count they write back is computed after
   * every earlier claim for the device has committed.
   */
  public Optional<KeyBundle> getForUpdate(Handle handle, UUID deviceId) {
    return handle.createQuery("SELECT * FROM key_bundles WHERE device_id = :device_id FOR UPDATE")
        .bind("device_id", deviceId)
        .mapTo(KeyBundle.class)
        .findOne();
  }

  /**
   * Returns every active device of the user that has published a bundle.
   */
  public List<DeviceKeyBundle> getActiveBundles(long userId) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("""
                SELECT d.*, b.* FROM devices d JOIN key_bundles b ON b.device_id = d.id
                WHERE d.user_id = :user_id AND d.status = :status
                ORDER BY d.created_at, d.id
                """)
            .bind("user_id", userId)
            .bind("status", ResultSets.toColumnValue(DeviceStatus.ACTIVE))
            .map((resultSet, ctx) -> new DeviceKeyBundle(DEVICE_ROW_MAPPER.map(resultSet, ctx),
                KEY_BUNDLE_ROW_MAPPER.map(resultSet, ctx)))
            .list()));
  }

  public void insert(Handle handle, KeyBundle bundle) {
    bindBundle(handle.createUpdate("""
            INSERT INTO key_bundles (device_id, identity_key, signed_prekey, signed_prekey_signature,
                                     bundle_version, prekeys_remaining, updated_at)
            VALUES (:device_id, :identity_key, :signed_prekey, :signed_prekey_signature,
                    :bundle_version, :prekeys_remaining, :updated_at)
            """), bundle)
        .execute();
  }

  public void update(Handle handle, KeyBundle bundle) {
    bindBundle(handle.createUpdate("""
            UPDATE key_bundles SET identity_key = :identity_key, signed_prekey = :signed_prekey,
                                   signed_prekey_signature = :signed_prekey_signature,
                                   bundle_version = :bundle_version, prekeys_remaining = :prekeys_remaining,
                                   updated_at = :updated_at
            WHERE device_id = :device_id
            """), bundle)
        .execute();
  }

  public void setPrekeysRemaining(Handle handle, UUID deviceId, int prekeysRemaining) {
    handle.createUpdate("UPDATE key_bundles SET prekeys_remaining = :prekeys_remaining WHERE device_id = :device_id")
        .bind("device_id", deviceId)
        .bind("prekeys_remaining", prekeysRemaining)
        .execute();
  }

  private static Update bindBundle(Update update, KeyBundle bundle) {
    return update.bind(DEVICE_ID, bundle.deviceId())
        .bind(IDENTITY_KEY, bundle.identityKey())
        .bind(SIGNED_PREKEY, bundle.signedPreKey())
        .bind(SIGNED_PREKEY_SIGNATURE, bundle.signedPreKeySignature())
        .bind(BUNDLE_VERSION, bundle.bundleVersion())
        .bind(PREKEYS_REMAINING, bundle.prekeysRemaining())
        .bind(UPDATED_AT, bundle.updatedAt().toEpochMilli());
  }
}
