/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.Device;
import org.whispersystems.keyserver.storage.DeviceStatus;
import org.whispersystems.keyserver.storage.Devices;

public class DeviceRowMapper implements RowMapper<Device> {

  @Override
  public Device map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new Device(ResultSets.getUuid(resultSet, Devices.ID),
        resultSet.getLong(Devices.USER_ID),
        resultSet.getString(Devices.NAME),
        ResultSets.getEnum(resultSet, Devices.STATUS, DeviceStatus.class),
        ResultSets.getInstant(resultSet, Devices.CREATED_AT),
        ResultSets.getNullableInstant(resultSet, Devices.LAST_SEEN_AT));
  }
}
