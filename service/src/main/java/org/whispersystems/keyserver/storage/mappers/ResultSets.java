/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * Column accessors shared by the row mappers. Timestamps are stored as epoch milliseconds and enums as lower-case
 * names.
 */
public class ResultSets {

  private ResultSets() {
  }

  public static Instant getInstant(final ResultSet resultSet, final String column) throws SQLException {
    return Instant.ofEpochMilli(resultSet.getLong(column));
  }

  @Nullable
  public static Instant getNullableInstant(final ResultSet resultSet, final String column) throws SQLException {
    final long millis = resultSet.getLong(column);
    return resultSet.wasNull() ? null : Instant.ofEpochMilli(millis);
  }

  @Nullable
  public static Long getNullableLong(final ResultSet resultSet, final String column) throws SQLException {
    final long value = resultSet.getLong(column);
    return resultSet.wasNull() ? null : value;
  }

  @Nullable
  public static Integer getNullableInt(final ResultSet resultSet, final String column) throws SQLException {
    final int value = resultSet.getInt(column);
    return resultSet.wasNull() ? null : value;
  }

  public static UUID getUuid(final ResultSet resultSet, final String column) throws SQLException {
    return resultSet.getObject(column, UUID.class);
  }

  public static <E extends Enum<E>> E getEnum(final ResultSet resultSet, final String column, final Class<E> type)
      throws SQLException {

    return Enum.valueOf(type, resultSet.getString(column).toUpperCase(Locale.ROOT));
  }

  public static String toColumnValue(final Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }

  @Nullable
  public static Long toMillis(@Nullable final Instant instant) {
    return instant == null ? null : instant.toEpochMilli();
  }
}
