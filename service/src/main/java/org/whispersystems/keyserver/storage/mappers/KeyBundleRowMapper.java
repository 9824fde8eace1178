/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.whispersystems.keyserver.storage.KeyBundle;
import org.whispersystems.keyserver.storage.KeyBundles;

public class KeyBundleRowMapper implements RowMapper<KeyBundle> {

  @Override
  public KeyBundle map(ResultSet resultSet, StatementContext ctx) throws SQLException {
    return new KeyBundle(ResultSets.getUuid(resultSet, KeyBundles.DEVICE_ID),
        resultSet.getString(KeyBundles.IDENTITY_KEY),
        resultSet.getString(KeyBundles.SIGNED_PREKEY),
        resultSet.getString(KeyBundles.SIGNED_PREKEY_SIGNATURE),
        resultSet.getLong(KeyBundles.BUNDLE_VERSION),
        resultSet.getInt(KeyBundles.PREKEYS_REMAINING),
        ResultSets.getInstant(resultSet, KeyBundles.UPDATED_AT));
  }
}
