/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.mappers;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.whispersystems.keyserver.controllers.ErrorCode;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.controllers.RateLimitExceededException;
import org.whispersystems.keyserver.entities.ErrorResponse;

class KeyServerExceptionMapperTest {

  private final KeyServerExceptionMapper mapper = new KeyServerExceptionMapper();

  @ParameterizedTest
  @MethodSource
  void status(final ErrorCode code, final int expectedStatus) {
    final Response response = mapper.toResponse(new KeyServerException(code, "nope"));

    assertThat(response.getStatus()).isEqualTo(expectedStatus);
    assertThat(response.getHeaderString(KeyServerExceptionMapper.ERROR_CODE_HEADER)).isEqualTo(code.name());
    assertThat(response.getEntity()).isEqualTo(new ErrorResponse(code.name(), "nope"));
  }

  private static Stream<Arguments> status() {
    return Stream.of(
        Arguments.of(ErrorCode.INVALID_REQUEST, 400),
        Arguments.of(ErrorCode.MESSAGE_TOO_LARGE, 400),
        Arguments.of(ErrorCode.FORBIDDEN, 403),
        Arguments.of(ErrorCode.BLOCKED, 403),
        Arguments.of(ErrorCode.RELATIONSHIP_REQUIRED, 403),
        Arguments.of(ErrorCode.NOT_FOUND, 404),
        Arguments.of(ErrorCode.PREKEY_NOT_FOUND, 404),
        Arguments.of(ErrorCode.BUNDLE_STALE, 409),
        Arguments.of(ErrorCode.EPOCH_STALE, 409),
        Arguments.of(ErrorCode.DEVICE_REVOKED, 409),
        Arguments.of(ErrorCode.INVITE_EXPIRED, 410));
  }

  @Test
  void contextHeaders() {
    final Response response = mapper.toResponse(KeyServerException.epochStale(7));

    assertThat(response.getStatus()).isEqualTo(409);
    assertThat(response.getHeaderString(KeyServerException.CURRENT_EPOCH_HEADER)).isEqualTo("7");
  }

  @Test
  void statusOverride() {
    final Response response = mapper.toResponse(
        new KeyServerException(ErrorCode.DEVICE_REVOKED, Response.Status.FORBIDDEN, "revoked"));

    assertThat(response.getStatus()).isEqualTo(403);
  }

  @Test
  void rateLimitExceeded() {
    final Response response = new RateLimitExceededExceptionMapper()
        .toResponse(new RateLimitExceededException(Duration.ofSeconds(7), 5, 0));

    assertThat(response.getStatus()).isEqualTo(429);
    assertThat(response.getHeaderString("Retry-After")).isEqualTo("7");
    assertThat(response.getHeaderString(RateLimitExceededExceptionMapper.LIMIT_HEADER)).isEqualTo("5");
    assertThat(response.getHeaderString(RateLimitExceededExceptionMapper.REMAINING_HEADER)).isEqualTo("0");
    assertThat(response.getHeaderString(KeyServerExceptionMapper.ERROR_CODE_HEADER)).isEqualTo("RATE_LIMITED");
  }

  @Test
  void rateLimitExceededNegativeRetry() {
    final Response response = new RateLimitExceededExceptionMapper()
        .toResponse(new RateLimitExceededException(Duration.ofSeconds(-1), 5, 0));

    assertThat(response.getHeaderString("Retry-After")).isNull();
  }
}
