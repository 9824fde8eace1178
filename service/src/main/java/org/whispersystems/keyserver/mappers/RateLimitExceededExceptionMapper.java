/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.mappers;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.keyserver.controllers.RateLimitExceededException;
import org.whispersystems.keyserver.entities.ErrorResponse;

@Provider
public class RateLimitExceededExceptionMapper implements ExceptionMapper<RateLimitExceededException> {

  private static final Logger logger = LoggerFactory.getLogger(RateLimitExceededExceptionMapper.class);

  public static final String LIMIT_HEADER = "X-RateLimit-Limit";
  public static final String REMAINING_HEADER = "X-RateLimit-Remaining";

  /**
   * Convert a RateLimitExceededException to a 429 response
   * with a Retry-After header and the violated window's limit and remaining allowance.
   *
   * @param e A RateLimitExceededException potentially containing a recommended retry duration
   * @return the response
   */
  @Override
  public Response toResponse(RateLimitExceededException e) {
    final Response.ResponseBuilder builder = Response.status(Response.Status.TOO_MANY_REQUESTS)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .header(KeyServerExceptionMapper.ERROR_CODE_HEADER, "RATE_LIMITED")
        .header(LIMIT_HEADER, e.getLimit())
        .header(REMAINING_HEADER, e.getRemaining())
        .entity(new ErrorResponse("RATE_LIMITED", "Rate limit exceeded"));

    e.getRetryDuration()
        .filter(d -> {
          if (d.isNegative()) {
            logger.warn("Encountered a negative retry duration: {}, will not include a Retry-After header in response",
                d);
          }
          // only include non-negative durations in retry headers
          return !d.isNegative();
        })
        .ifPresent(d -> builder.header("Retry-After", d.toSeconds()));

    return builder.build();
  }
}
