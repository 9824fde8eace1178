/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.tests.util;

import io.dropwizard.auth.AuthFilter;
import io.dropwizard.auth.basic.BasicCredentialAuthFilter;
import io.dropwizard.auth.basic.BasicCredentials;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Set;
import org.whispersystems.keyserver.auth.AuthenticatedUser;
import org.whispersystems.keyserver.auth.CallerTokenAuthenticator;
import org.whispersystems.keyserver.auth.CallerTokens;
import org.whispersystems.keyserver.identity.RelationshipDirectory;

public class AuthHelper {

  public static final long VALID_USER_ID = 1111;
  public static final long VALID_USER_ID_TWO = 2222;
  public static final long OPERATOR_USER_ID = 9999;
  public static final long UNKNOWN_USER_ID = 4444;

  private static final byte[] TOKEN_KEY = new byte[32];

  public static final CallerTokens CALLER_TOKENS = new CallerTokens(TOKEN_KEY, Duration.ofDays(1), Clock.systemUTC());

  private static final Set<Long> KNOWN_USERS = Set.of(VALID_USER_ID, VALID_USER_ID_TWO, OPERATOR_USER_ID);

  private static final RelationshipDirectory RELATIONSHIP_DIRECTORY = new RelationshipDirectory() {
    @Override
    public boolean exists(final long userId) {
      return KNOWN_USERS.contains(userId);
    }

    @Override
    public boolean isBlocked(final long blockerId, final long blockedId) {
      return false;
    }

    @Override
    public boolean isOperator(final long userId) {
      return userId == OPERATOR_USER_ID;
    }
  };

  public static AuthFilter<BasicCredentials, AuthenticatedUser> getAuthFilter() {
    return new BasicCredentialAuthFilter.Builder<AuthenticatedUser>()
        .setAuthenticator(new CallerTokenAuthenticator(CALLER_TOKENS, RELATIONSHIP_DIRECTORY))
        .buildAuthFilter();
  }

  public static String getAuthHeader(final long userId) {
    return getAuthHeader(userId, CALLER_TOKENS.generate(userId));
  }

  public static String getAuthHeader(final long userId, final String token) {
    return "Basic " + Base64.getEncoder().encodeToString((userId + ":" + token).getBytes(StandardCharsets.UTF_8));
  }
}
