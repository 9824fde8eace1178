/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.jdbi.v3.core.Handle;
import org.whispersystems.keyserver.entities.AggregateMetrics;
import org.whispersystems.keyserver.storage.mappers.ResultSets;

/**
 * Read-only aggregate queries for the operator metrics view.
 */
public class Statistics {

  private static final String ACTIVE_DEVICE_POOLS = """
      SELECT d.id AS device_id, d.user_id AS user_id,
        (SELECT COUNT(*) FROM one_time_prekeys p WHERE p.device_id = d.id AND p.claimed = FALSE) AS available
      FROM devices d JOIN key_bundles b ON b.device_id = d.id
      WHERE d.status = 'active'
      """;

  private record PoolTotals(int devices, long available, int belowLow, int belowCritical) {
  }

  private final FaultTolerantDatabase database;

  public Statistics(FaultTolerantDatabase database) {
    this.database = database;
  }

  public AggregateMetrics.PreKeys getPreKeyStats(int lowWatermark, int criticalWatermark, int sampleSize) {
    return database.with(jdbi -> jdbi.withHandle(handle -> {
      final PoolTotals totals = handle.createQuery("SELECT COUNT(*) AS devices, "
                  + "COALESCE(SUM(available), 0) AS available, "
                  + "COALESCE(SUM(CASE WHEN available < :low THEN 1 ELSE 0 END), 0) AS below_low, "
                  + "COALESCE(SUM(CASE WHEN available < :critical THEN 1 ELSE 0 END), 0) AS below_critical "
                  + "FROM (" + ACTIVE_DEVICE_POOLS + ") pools")
          .bind("low", lowWatermark)
          .bind("critical", criticalWatermark)
          .map((resultSet, ctx) -> new PoolTotals(resultSet.getInt("devices"),
              resultSet.getLong("available"),
              resultSet.getInt("below_low"),
              resultSet.getInt("below_critical")))
          .one();

      final long claimed = handle.createQuery("SELECT COUNT(*) FROM one_time_prekeys WHERE claimed = TRUE")
          .mapTo(Long.class)
          .one();

      return new AggregateMetrics.PreKeys(totals.devices(), totals.available(), claimed,
          totals.belowLow(), totals.belowCritical(), lowWatermark, criticalWatermark,
          getPoolsBelow(handle, lowWatermark, sampleSize), getPoolsBelow(handle, criticalWatermark, sampleSize));
    }));
  }

  private static List<AggregateMetrics.DevicePool> getPoolsBelow(Handle handle, int watermark, int sampleSize) {
    return handle.createQuery("SELECT * FROM (" + ACTIVE_DEVICE_POOLS + ") pools "
            + "WHERE available < :watermark ORDER BY available, device_id LIMIT :limit")
        .bind("watermark", watermark)
        .bind("limit", sampleSize)
        .map((resultSet, ctx) -> new AggregateMetrics.DevicePool(ResultSets.getUuid(resultSet, "device_id"),
            resultSet.getLong("user_id"),
            resultSet.getInt("available")))
        .list();
  }

  /**
   * Counts active devices whose signed prekey is due for rotation or past its maximum age.
   */
  public AggregateMetrics.SignedPreKeys getSignedPreKeyStats(Instant now, Duration rotation, Duration maxAge) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("""
                SELECT COALESCE(SUM(CASE WHEN b.updated_at <= :rotation THEN 1 ELSE 0 END), 0) AS rotation_due,
                       COALESCE(SUM(CASE WHEN b.updated_at <= :stale THEN 1 ELSE 0 END), 0) AS stale
                FROM key_bundles b JOIN devices d ON d.id = b.device_id
                WHERE d.status = 'active'
                """)
            .bind("rotation", now.minus(rotation).toEpochMilli())
            .bind("stale", now.minus(maxAge).toEpochMilli())
            .map((resultSet, ctx) -> new AggregateMetrics.SignedPreKeys(resultSet.getInt("rotation_due"),
                resultSet.getInt("stale"),
                rotation.toSeconds(),
                maxAge.toSeconds()))
            .one()));
  }

  public AggregateMetrics.MessageVolume getMessageVolume(Instant startOfDay, Instant oneHourAgo) {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("""
                SELECT
                  COALESCE(SUM(CASE WHEN created_at >= :start_of_day THEN 1 ELSE 0 END), 0) AS today,
                  COALESCE(SUM(CASE WHEN created_at >= :hour_ago THEN 1 ELSE 0 END), 0) AS last_hour,
                  COALESCE(SUM(CASE WHEN created_at >= :hour_ago AND thread_type = 'conversation' THEN 1 ELSE 0 END), 0)
                    AS conversation_last_hour,
                  COALESCE(SUM(CASE WHEN created_at >= :hour_ago AND thread_type = 'group' THEN 1 ELSE 0 END), 0)
                    AS group_last_hour
                FROM messages
                WHERE created_at >= :since
                """)
            .bind("start_of_day", startOfDay.toEpochMilli())
            .bind("hour_ago", oneHourAgo.toEpochMilli())
            .bind("since", Math.min(startOfDay.toEpochMilli(), oneHourAgo.toEpochMilli()))
            .map((resultSet, ctx) -> new AggregateMetrics.MessageVolume(resultSet.getLong("today"),
                resultSet.getLong("last_hour"),
                resultSet.getLong("conversation_last_hour"),
                resultSet.getLong("group_last_hour")))
            .one()));
  }

  /**
   * Receipt backlog, and latency between send and delivery for receipts delivered since {@code since}.
   */
  public AggregateMetrics.Delivery getDeliveryStats(Instant since) {
    return database.with(jdbi -> jdbi.withHandle(handle -> {
      final long[] backlog = handle.createQuery("""
              SELECT COALESCE(SUM(CASE WHEN delivered_at IS NULL THEN 1 ELSE 0 END), 0) AS undelivered,
                     COALESCE(SUM(CASE WHEN read_at IS NULL THEN 1 ELSE 0 END), 0) AS unread
              FROM delivery_receipts
              """)
          .map((resultSet, ctx) -> new long[]{resultSet.getLong("undelivered"), resultSet.getLong("unread")})
          .one();

      return handle.createQuery("""
              SELECT AVG(CAST(r.delivered_at - m.created_at AS DOUBLE PRECISION)) AS average_latency,
                     MAX(r.delivered_at - m.created_at) AS max_latency
              FROM delivery_receipts r JOIN messages m ON m.id = r.message_id
              WHERE r.delivered_at >= :since
              """)
          .bind("since", since.toEpochMilli())
          .map((resultSet, ctx) -> {
            final double average = resultSet.getDouble("average_latency");
            final Double averageLatency = resultSet.wasNull() ? null : average;

            return new AggregateMetrics.Delivery(backlog[0], backlog[1], averageLatency,
                ResultSets.getNullableLong(resultSet, "max_latency"));
          })
          .one();
    }));
  }

  public AggregateMetrics.DeviceCounts getDeviceCounts() {
    return database.with(jdbi -> jdbi.withHandle(handle ->
        handle.createQuery("""
                SELECT COALESCE(SUM(CASE WHEN status = 'active' THEN 1 ELSE 0 END), 0) AS active,
                       COALESCE(SUM(CASE WHEN status = 'revoked' THEN 1 ELSE 0 END), 0) AS revoked
                FROM devices
                """)
            .map((resultSet, ctx) -> new AggregateMetrics.DeviceCounts(resultSet.getInt("active"),
                resultSet.getInt("revoked")))
            .one()));
  }

  public AggregateMetrics.GroupStats getGroupStats(Instant rekeyedSince) {
    return database.with(jdbi -> jdbi.withHandle(handle -> {
      final long senderKeyEntries = handle.createQuery("""
              SELECT COUNT(*) FROM group_sender_keys k JOIN chat_groups g ON g.id = k.group_id
              WHERE k.group_epoch = g.group_epoch
              """)
          .mapTo(Long.class)
          .one();

      return handle.createQuery("""
              SELECT COUNT(*) AS total,
                     COALESCE(SUM(CASE WHEN is_closed = FALSE THEN 1 ELSE 0 END), 0) AS open_groups,
                     COALESCE(SUM(CASE WHEN is_closed = TRUE THEN 1 ELSE 0 END), 0) AS closed_groups,
                     COALESCE(AVG(CAST(active_member_count AS DOUBLE PRECISION)), 0) AS average_members,
                     COALESCE(SUM(CASE WHEN epoch_changed_at >= :since THEN 1 ELSE 0 END), 0) AS rekeyed
              FROM chat_groups
              """)
          .bind("since", rekeyedSince.toEpochMilli())
          .map((resultSet, ctx) -> new AggregateMetrics.GroupStats(resultSet.getInt("total"),
              resultSet.getInt("open_groups"),
              resultSet.getInt("closed_groups"),
              resultSet.getDouble("average_members"),
              senderKeyEntries,
              resultSet.getInt("rekeyed")))
          .one();
    }));
  }
}
