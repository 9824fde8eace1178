/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.OneTimePreKey;
import org.whispersystems.keyserver.storage.OneTimePreKeys;

public class OneTimePreKeyRowMapper implements RowMapper<OneTimePreKey> {

  @Override
  public OneTimePreKey map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new OneTimePreKey(resultSet.getLong(OneTimePreKeys.ID),
        ResultSets.getUuid(resultSet, OneTimePreKeys.DEVICE_ID),
        resultSet.getString(OneTimePreKeys.PUBLIC_KEY),
        resultSet.getBoolean(OneTimePreKeys.CLAIMED));
  }
}
