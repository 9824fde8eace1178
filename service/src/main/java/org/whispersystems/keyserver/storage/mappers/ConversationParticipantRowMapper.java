/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.ConversationParticipant;
import org.whispersystems.keyserver.storage.Conversations;

public class ConversationParticipantRowMapper implements RowMapper<ConversationParticipant> {

  @Override
  public ConversationParticipant map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new ConversationParticipant(ResultSets.getUuid(resultSet, Conversations.PARTICIPANT_CONVERSATION_ID),
        resultSet.getLong(Conversations.PARTICIPANT_USER_ID),
        parseDeviceIds(resultSet.getString(Conversations.PARTICIPANT_DEVICE_IDS)));
  }

  public static List<UUID> parseDeviceIds(final String deviceIds) {
    if (deviceIds == null || deviceIds.isBlank()) {
      return Collections.emptyList();
    }

    return Arrays.stream(deviceIds.split(","))
        .map(UUID::fromString)
        .collect(Collectors.toList());
  }

  public static String formatDeviceIds(final List<UUID> deviceIds) {
    return deviceIds.stream().map(UUID::toString).collect(Collectors.joining(","));
  }
}
