/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.Conversation;
import org.whispersystems.keyserver.storage.Conversations;

public class ConversationRowMapper implements RowMapper<Conversation> {

  @Override
  public Conversation map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new Conversation(ResultSets.getUuid(resultSet, Conversations.ID),
        resultSet.getString(Conversations.PAIR_KEY),
        ResultSets.getInstant(resultSet, Conversations.CREATED_AT),
        ResultSets.getNullableInstant(resultSet, Conversations.LAST_MESSAGE_AT));
  }
}
