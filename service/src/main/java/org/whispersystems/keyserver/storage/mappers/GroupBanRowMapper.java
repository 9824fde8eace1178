/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.GroupBan;
import org.whispersystems.keyserver.storage.Groups;

public class GroupBanRowMapper implements RowMapper<GroupBan> {

  @Override
  public GroupBan map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new GroupBan(ResultSets.getUuid(resultSet, Groups.BAN_GROUP_ID),
        resultSet.getLong(Groups.BAN_USER_ID),
        resultSet.getLong(Groups.BAN_BANNED_BY),
        resultSet.getString(Groups.BAN_REASON),
        ResultSets.getInstant(resultSet, Groups.BAN_BANNED_AT));
  }
}
