/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.SenderKeyRecord;
import org.whispersystems.keyserver.storage.SenderKeys;

public class SenderKeyRecordRowMapper implements RowMapper<SenderKeyRecord> {

  @Override
  public SenderKeyRecord map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new SenderKeyRecord(ResultSets.getUuid(resultSet, SenderKeys.GROUP_ID),
        resultSet.getLong(SenderKeys.SENDER_USER_ID),
        ResultSets.getUuid(resultSet, SenderKeys.SENDER_DEVICE_ID),
        resultSet.getLong(SenderKeys.GROUP_EPOCH),
        resultSet.getString(SenderKeys.SENDER_KEY_ID),
        resultSet.getInt(SenderKeys.CHAIN_INDEX),
        ResultSets.getInstant(resultSet, SenderKeys.ROTATED_AT));
  }
}
