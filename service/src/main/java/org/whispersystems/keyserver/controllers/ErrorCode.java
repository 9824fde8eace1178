/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.controllers;

import jakarta.ws.rs.core.Response;

/**
 * Stable, machine-readable failure codes. The names are part of the public API and must not change.
 */
public enum ErrorCode {
  INVALID_REQUEST(Response.Status.BAD_REQUEST),
  MESSAGE_TOO_LARGE(Response.Status.BAD_REQUEST),
  NO_ACTIVE_DEVICE(Response.Status.BAD_REQUEST),
  TARGET_USER_REQUIRED(Response.Status.BAD_REQUEST),
  EXPIRY_IN_PAST(Response.Status.BAD_REQUEST),

  FORBIDDEN(Response.Status.FORBIDDEN),
  DISABLED(Response.Status.FORBIDDEN),
  BLOCKED(Response.Status.FORBIDDEN),
  RELATIONSHIP_REQUIRED(Response.Status.FORBIDDEN),
  NOT_MEMBER(Response.Status.FORBIDDEN),
  GROUP_CLOSED(Response.Status.FORBIDDEN),
  BANNED(Response.Status.FORBIDDEN),
  NOT_INVITED(Response.Status.FORBIDDEN),

  NOT_FOUND(Response.Status.NOT_FOUND),
  PREKEY_NOT_FOUND(Response.Status.NOT_FOUND),

  DEVICE_REVOKED(Response.Status.CONFLICT),
  BUNDLE_STALE(Response.Status.CONFLICT),
  PREKEYS_EXHAUSTED(Response.Status.CONFLICT),
  IDENTITY_CHANGE_BLOCKED(Response.Status.CONFLICT),
  EPOCH_STALE(Response.Status.CONFLICT),
  GROUP_FULL(Response.Status.CONFLICT),
  MAX_USES(Response.Status.CONFLICT),
  INVITE_CODE_CONFLICT(Response.Status.CONFLICT),

  INVITE_EXPIRED(Response.Status.GONE);

  private final Response.Status status;

  ErrorCode(final Response.Status status) {
    this.status = status;
  }

  public Response.Status getStatus() {
    return status;
  }
}
