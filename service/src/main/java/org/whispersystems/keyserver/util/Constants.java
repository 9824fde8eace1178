/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.util;

public class Constants {

  /**
   * Security-relevant events (identity-key changes, revocations, use of revoked devices) are logged here.
   */
  public static final String AUDIT_LOGGER_NAME = "org.whispersystems.keyserver.audit";
}
