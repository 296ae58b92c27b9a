package com.codeheadsystems.shardvault.factory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.shardvault.model.VaultConfiguration;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VaultConfigurationFactoryTest {

  private final VaultConfigurationFactory factory = new VaultConfigurationFactory();

  @Test
  void fromResource() {
    final VaultConfiguration configuration = factory.fromResource("config/vault-test.json");
    assertThat(configuration.prefix()).isEqualTo("test:vault:");
    assertThat(configuration.shardCount()).isEqualTo(4);
    assertThat(configuration.completionMarker()).isTrue();
    assertThat(configuration.enforceUniqueKeyIds()).isTrue();
    assertThat(configuration.database()).hasValueSatisfying(database -> {
      assertThat(database.url()).isEqualTo("jdbc:hsqldb:mem:VaultConfigurationFactoryTest");
      assertThat(database.password()).isEqualTo("secret");
    });
    assertThat(configuration.toString()).doesNotContain("secret");
  }

  @Test
  void fromResource_missing() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> factory.fromResource("config/nope.json"));
  }

  @Test
  void fromPath(@TempDir final Path dir) throws IOException {
    final Path file = dir.resolve("vault.json");
    Files.writeString(file, "{\"shardCount\": 2}");
    final VaultConfiguration configuration = factory.fromPath(file);
    assertThat(configuration.shardCount()).isEqualTo(2);
    assertThat(configuration.prefix()).isEqualTo(VaultConfiguration.DEFAULT_PREFIX);
    assertThat(configuration.database()).isEmpty();
  }

  @Test
  void fromPath_missing(@TempDir final Path dir) {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> factory.fromPath(dir.resolve("missing.json")));
  }

  @Test
  void fromJson_defaults() {
    assertThat(factory.fromJson("{}")).isEqualTo(VaultConfiguration.defaults());
  }

  @Test
  void fromJson_invalid() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> factory.fromJson("{\"shardCount\": 0}"));
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> factory.fromJson("not json"));
  }

}
