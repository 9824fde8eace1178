/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.util.List;
import java.util.UUID;
import org.jdbi.v3.core.Handle;
import org.whispersystems.keyserver.storage.mappers.SenderKeyRecordRowMapper;

public class SenderKeys {

  public static final String GROUP_ID         = "group_id";
  public static final String SENDER_USER_ID   = "sender_user_id";
  public static final String SENDER_DEVICE_ID = "sender_device_id";
  public static final String GROUP_EPOCH      = "group_epoch";
  public static final String SENDER_KEY_ID    = "sender_key_id";
  public static final String CHAIN_INDEX      = "chain_index";
  public static final String ROTATED_AT       = "rotated_at";

  private final FaultTolerantDatabase database;

  public SenderKeys(FaultTolerantDatabase database) {
    this.database = database;
    this.database.getDatabase().registerRowMapper(new SenderKeyRecordRowMapper());
  }

  /**
   * Stores the record, replacing the same device's record for the same epoch.
   */
  public void put(Handle handle, SenderKeyRecord record) {
    final int updated = handle.createUpdate("""
            UPDATE group_sender_keys SET sender_key_id = :sender_key_id, chain_index = :chain_index,
                                         rotated_at = :rotated_at
            WHERE group_id = :group_id AND sender_user_id = :sender_user_id
              AND sender_device_id = :sender_device_id AND group_epoch = :group_epoch
            """)
        .bind(GROUP_ID, record.groupId())
        .bind(SENDER_USER_ID, record.senderUserId())
        .bind(SENDER_DEVICE_ID, record.senderDeviceId())
        .bind(GROUP_EPOCH, record.groupEpoch())
        .bind(SENDER_KEY_ID, record.senderKeyId())
        .bind(CHAIN_INDEX, record.chainIndex())
        .bind(ROTATED_AT, record.rotatedAt().toEpochMilli())
        .execute();

    if (updated == 0) {
      handle.createUpdate("""
              INSERT INTO group_sender_keys (group_id, sender_user_id, sender_device_id, group_epoch, sender_key_id,
                                             chain_index, rotated_at)
              VALUES (:group_id, :sender_user_id, :sender_device_id, :group_epoch, :sender_key_id,
                      :chain_index, :rotated_at)
              """)
          .bind(GROUP_ID, record.groupId())
          .bind(SENDER_USER_ID, record.senderUserId())
          .bind(SENDER_DEVICE_ID, record.senderDeviceId())
          .bind(GROUP_EPOCH, record.groupEpoch())
          .bind(SENDER_KEY_ID, record.senderKeyId())
          .bind(CHAIN_INDEX, record.chainIndex())
          .bind(ROTATED_AT, record.rotatedAt().toEpochMilli())
          .execute();
    }
  }

  public List<SenderKeyRecord> getForEpoch(UUID groupId, long groupEpoch) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("""
                SELECT * FROM group_sender_keys WHERE group_id = :group_id AND group_epoch = :group_epoch
                ORDER BY sender_user_id, sender_device_id
                """)
            .bind("group_id", groupId)
            .bind("group_epoch", groupEpoch)
            .mapTo(SenderKeyRecord.class)
            .list()));
  }
}
