/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.controllers;

import jakarta.ws.rs.core.Response;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A typed request failure. Context headers carry the authoritative state (a bundle version, a group epoch) a caller
 * needs to resynchronize instead of retrying blindly.
 */
public class KeyServerException extends RuntimeException {

  public static final String BUNDLE_VERSION_HEADER = "X-Bundle-Version";
  public static final String CURRENT_EPOCH_HEADER = "X-Current-Epoch";

  private final ErrorCode code;
  private final Response.Status status;
  private final Map<String, String> context;

  public KeyServerException(final ErrorCode code, final String message) {
    this(code, code.getStatus(), message, Collections.emptyMap());
  }

  public KeyServerException(final ErrorCode code, final Response.Status status, final String message) {
    this(code, status, message, Collections.emptyMap());
  }

  private KeyServerException(final ErrorCode code, final Response.Status status, final String message,
      final Map<String, String> context) {

    super(message, null, true, false);
    this.code = code;
    this.status = status;
    this.context = context;
  }

  public static KeyServerException bundleStale(final long bundleVersion) {
    return withContext(ErrorCode.BUNDLE_STALE, "Key bundle has changed", BUNDLE_VERSION_HEADER, bundleVersion);
  }

  public static KeyServerException prekeysExhausted(final long bundleVersion) {
    return withContext(ErrorCode.PREKEYS_EXHAUSTED, "No one-time prekeys available", BUNDLE_VERSION_HEADER,
        bundleVersion);
  }

  public static KeyServerException epochStale(final long currentEpoch) {
    return withContext(ErrorCode.EPOCH_STALE, "Group epoch has changed", CURRENT_EPOCH_HEADER, currentEpoch);
  }

  private static KeyServerException withContext(final ErrorCode code, final String message, final String header,
      final long value) {

    final Map<String, String> context = new LinkedHashMap<>();
    context.put(header, String.valueOf(value));

    return new KeyServerException(code, code.getStatus(), message, Collections.unmodifiableMap(context));
  }

  public ErrorCode getCode() {
    return code;
  }

  public Response.Status getStatus() {
    return status;
  }

  public Map<String, String> getContext() {
    return context;
  }
}
