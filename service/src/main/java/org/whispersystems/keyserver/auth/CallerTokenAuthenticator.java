/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.auth;

import static org.whispersystems.keyserver.metrics.MetricsUtil.name;

import io.dropwizard.auth.Authenticator;
import io.dropwizard.auth.basic.BasicCredentials;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import java.util.Optional;
import org.whispersystems.keyserver.identity.RelationshipDirectory;

/**
 * Authenticates callers presenting HTTP Basic credentials of the form {@code userId:callerToken}.
 */
public class CallerTokenAuthenticator implements Authenticator<BasicCredentials, AuthenticatedUser> {

  private static final String AUTHENTICATION_COUNTER_NAME = name(CallerTokenAuthenticator.class, "authentication");
  private static final String AUTHENTICATION_SUCCEEDED_TAG_NAME = "succeeded";
  private static final String AUTHENTICATION_FAILURE_REASON_TAG_NAME = "reason";

  private final CallerTokens callerTokens;
  private final RelationshipDirectory relationshipDirectory;

  public CallerTokenAuthenticator(final CallerTokens callerTokens, final RelationshipDirectory relationshipDirectory) {
    this.callerTokens = callerTokens;
    this.relationshipDirectory = relationshipDirectory;
  }

  @Override
  public Optional<AuthenticatedUser> authenticate(final BasicCredentials credentials) {
    boolean succeeded = false;
    String failureReason = null;

    try {
      final long userId;

      try {
        userId = Long.parseLong(credentials.getUsername());
      } catch (final NumberFormatException e) {
        failureReason = "invalidUserId";
        return Optional.empty();
      }

      if (!callerTokens.verify(userId, credentials.getPassword())) {
        failureReason = "invalidToken";
        return Optional.empty();
      }

      if (!relationshipDirectory.exists(userId)) {
        failureReason = "noSuchUser";
        return Optional.empty();
      }

      succeeded = true;

      return Optional.of(new AuthenticatedUser(userId, relationshipDirectory.isOperator(userId)));
    } finally {
      Tags tags = Tags.of(AUTHENTICATION_SUCCEEDED_TAG_NAME, String.valueOf(succeeded));

      if (failureReason != null) {
        tags = tags.and(AUTHENTICATION_FAILURE_REASON_TAG_NAME, failureReason);
      }

      Metrics.counter(AUTHENTICATION_COUNTER_NAME, tags).increment();
    }
  }
}
