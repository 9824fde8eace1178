/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.mappers;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.whispersystems.keyserver.controllers.KeyServerException;
import org.whispersystems.keyserver.entities.ErrorResponse;

@Provider
public class KeyServerExceptionMapper implements ExceptionMapper<KeyServerException> {

  public static final String ERROR_CODE_HEADER = "X-Error-Code";

  @Override
  public Response toResponse(final KeyServerException e) {
    final Response.ResponseBuilder builder = Response.status(e.getStatus())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .header(ERROR_CODE_HEADER, e.getCode().name())
        .entity(new ErrorResponse(e.getCode().name(), e.getMessage()));

    e.getContext().forEach(builder::header);

    return builder.build();
  }
}
