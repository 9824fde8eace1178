/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.auth;

import java.security.Principal;
import javax.security.auth.Subject;

/**
 * A caller whose identity the host application has vouched for.
 */
public class AuthenticatedUser implements Principal {

  private final long userId;
  private final boolean operator;

  public AuthenticatedUser(final long userId, final boolean operator) {
    this.userId = userId;
    this.operator = operator;
  }

  public long getUserId() {
    return userId;
  }

  public boolean isOperator() {
    return operator;
  }

  // Principal implementation

  @Override
  public String getName() {
    return String.valueOf(userId);
  }

  @Override
  public boolean implies(final Subject subject) {
    return false;
  }
}
