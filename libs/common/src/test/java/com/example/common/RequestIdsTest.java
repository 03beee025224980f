package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class RequestIdsTest {

  @Test
  void keepsWellFormedCallerId() {
    assertThat(RequestIds.resolve(" req-1 ")).isEqualTo("req-1");
  }

  @Test
  void generatesIdWhenMissing() {
    final String generated = RequestIds.resolve(null);

    assertThat(UUID.fromString(generated)).isNotNull();
  }

  @Test
  void replacesIdContainingLogBreakingCharacters() {
    final String generated = RequestIds.resolve("abc\nforged=1");

    assertThat(generated).doesNotContain("\n");
    assertThat(UUID.fromString(generated)).isNotNull();
  }

  @Test
  void replacesOverlongId() {
    assertThat(RequestIds.resolve("a".repeat(200))).hasSize(36);
  }
}
