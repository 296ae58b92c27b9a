package com.codeheadsystems.shardvault.utilities;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class KeyIdGeneratorTest {

  private static final Instant NOW = Instant.parse("2025-12-30T12:00:00Z");

  private final KeyIdGenerator generator =
      new KeyIdGenerator(Clock.fixed(NOW, ZoneId.of("UTC")), new SecureRandom());

  @Test
  void generate_format() {
    assertThat(generator.generate("openai"))
        .matches("openai-" + NOW.toEpochMilli() + "-[0-9a-z]{8}");
  }

  @Test
  void generate_serviceKeptVerbatim() {
    assertThat(generator.generate("my service")).startsWith("my service-");
  }

  @Test
  void generate_suffixVaries() {
    final Set<String> ids = new HashSet<>();
    for (int i = 0; i < 1000; i++) {
      ids.add(generator.generate("svc"));
    }
    assertThat(ids).hasSize(1000);
  }

}
