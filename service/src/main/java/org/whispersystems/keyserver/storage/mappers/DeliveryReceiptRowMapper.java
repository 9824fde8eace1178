/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.DeliveryReceipt;
import org.whispersystems.keyserver.storage.Messages;

public class DeliveryReceiptRowMapper implements RowMapper<DeliveryReceipt> {

  @Override
  public DeliveryReceipt map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new DeliveryReceipt(ResultSets.getUuid(resultSet, Messages.RECEIPT_MESSAGE_ID),
        resultSet.getLong(Messages.RECEIPT_RECIPIENT_USER_ID),
        ResultSets.getNullableInstant(resultSet, Messages.RECEIPT_DELIVERED_AT),
        ResultSets.getNullableInstant(resultSet, Messages.RECEIPT_READ_AT));
  }
}
