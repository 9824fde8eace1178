/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

import java.sql.SQLException;

public class UniqueConstraintViolations {

  private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

  private UniqueConstraintViolations() {
  }

  /**
   * Returns true if the throwable, or anything in its cause chain, reports a unique constraint violation.
   */
  public static boolean isUniqueViolation(final Throwable throwable) {
    for (Throwable cause = throwable; cause != null; cause = cause.getCause()) {
      if (cause instanceof SQLException sqlException
          && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState())) {
        return true;
      }
    }

    return false;
  }
}
