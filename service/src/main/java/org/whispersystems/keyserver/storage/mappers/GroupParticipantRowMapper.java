/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.GroupParticipant;
import org.whispersystems.keyserver.storage.GroupRole;
import org.whispersystems.keyserver.storage.Groups;

public class GroupParticipantRowMapper implements RowMapper<GroupParticipant> {

  @Override
  public GroupParticipant map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new GroupParticipant(ResultSets.getUuid(resultSet, Groups.PARTICIPANT_GROUP_ID),
        resultSet.getLong(Groups.PARTICIPANT_USER_ID),
        ResultSets.getEnum(resultSet, Groups.PARTICIPANT_ROLE, GroupRole.class),
        resultSet.getBoolean(Groups.PARTICIPANT_BANNED),
        ResultSets.getInstant(resultSet, Groups.PARTICIPANT_JOINED_AT),
        ResultSets.getNullableInstant(resultSet, Groups.PARTICIPANT_MUTE_UNTIL));
  }
}
