/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.Group;
import org.whispersystems.keyserver.storage.Groups;

public class GroupRowMapper implements RowMapper<Group> {

  @Override
  public Group map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new Group(ResultSets.getUuid(resultSet, Groups.ID),
        resultSet.getString(Groups.TITLE),
        resultSet.getString(Groups.ABOUT),
        resultSet.getLong(Groups.CREATED_BY),
        resultSet.getInt(Groups.MAX_PARTICIPANTS),
        resultSet.getLong(Groups.EPOCH),
        resultSet.getInt(Groups.ACTIVE_MEMBER_COUNT),
        resultSet.getBoolean(Groups.CLOSED),
        ResultSets.getInstant(resultSet, Groups.CREATED_AT),
        ResultSets.getInstant(resultSet, Groups.UPDATED_AT),
        ResultSets.getNullableInstant(resultSet, Groups.EPOCH_CHANGED_AT),
        ResultSets.getNullableInstant(resultSet, Groups.LAST_MESSAGE_AT));
  }
}
