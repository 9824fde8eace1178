/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keyserver.entities;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import javax.annotation.Nullable;

public record CreateGroupRequest(@NotBlank @Size(max = 128) String title, @Nullable @Size(max = 1024) String about) {
}
