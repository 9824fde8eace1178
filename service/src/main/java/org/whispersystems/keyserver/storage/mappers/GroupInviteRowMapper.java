/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.GroupInvite;
import org.whispersystems.keyserver.storage.GroupInvites;
import org.whispersystems.keyserver.storage.InviteType;

public class GroupInviteRowMapper implements RowMapper<GroupInvite> {

  @Override
  public GroupInvite map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new GroupInvite(ResultSets.getUuid(resultSet, GroupInvites.ID),
        ResultSets.getUuid(resultSet, GroupInvites.GROUP_ID),
        resultSet.getLong(GroupInvites.CREATED_BY),
        ResultSets.getEnum(resultSet, GroupInvites.TYPE, InviteType.class),
        resultSet.getString(GroupInvites.CODE),
        ResultSets.getInstant(resultSet, GroupInvites.EXPIRES_AT),
        ResultSets.getNullableInt(resultSet, GroupInvites.MAX_USES),
        resultSet.getInt(GroupInvites.USES),
        ResultSets.getNullableLong(resultSet, GroupInvites.TARGET_USER_ID),
        ResultSets.getInstant(resultSet, GroupInvites.CREATED_AT));
  }
}
