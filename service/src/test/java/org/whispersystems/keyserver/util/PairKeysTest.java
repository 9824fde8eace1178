/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keyserver.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PairKeysTest {

  @Test
  void orderIndependent() {
    assertThat(PairKeys.of(1111, 2222)).isEqualTo(PairKeys.of(2222, 1111));
    assertThat(PairKeys.of(1111, 2222)).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  void distinctPairs() {
    assertThat(PairKeys.of(1, 23)).isNotEqualTo(PairKeys.of(12, 3));
    assertThat(PairKeys.of(1111, 2222)).isNotEqualTo(PairKeys.of(1111, 3333));
  }
}
