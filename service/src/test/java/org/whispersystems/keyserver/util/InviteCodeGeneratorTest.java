/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class InviteCodeGeneratorTest {

  @Test
  void get() {
    final InviteCodeGenerator generator = new InviteCodeGenerator(12);
    final Set<String> codes = new HashSet<>();

    for (int i = 0; i < 100; i++) {
      final String code = generator.get();

      assertThat(code).hasSize(12).doesNotContain("0", "O", "1", "l", "I");
      codes.add(code);
    }

    assertThat(codes).hasSize(100);
  }
}
