/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.Messages;
import org.whispersystems.keyserver.storage.StoredMessage;
import org.whispersystems.keyserver.storage.ThreadType;

public class StoredMessageRowMapper implements RowMapper<StoredMessage> {

  @Override
  public StoredMessage map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new StoredMessage(ResultSets.getUuid(resultSet, Messages.ID),
        ResultSets.getEnum(resultSet, Messages.THREAD_TYPE, ThreadType.class),
        ResultSets.getUuid(resultSet, Messages.THREAD_ID),
        resultSet.getLong(Messages.SENDER_USER_ID),
        ResultSets.getUuid(resultSet, Messages.SENDER_DEVICE_ID),
        resultSet.getBytes(Messages.CIPHERTEXT),
        resultSet.getInt(Messages.PROTO),
        ResultSets.getNullableLong(resultSet, Messages.GROUP_EPOCH),
        ResultSets.getInstant(resultSet, Messages.CREATED_AT),
        resultSet.getString(Messages.CLIENT_MESSAGE_ID));
  }
}
