/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.storage;

/**
 * The kind of destination a stored message belongs to.
 */
public enum ThreadType {
  CONVERSATION,
  GROUP
}
