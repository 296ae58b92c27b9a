package com.codeheadsystems.shardvault.model;

import com.codeheadsystems.dbu.model.Database;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Vault configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableVaultConfiguration.class)
@JsonDeserialize(builder = ImmutableVaultConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface VaultConfiguration {

  /**
   * Namespace for every slot the vault writes. Matches the layout of existing stores.
   */
  String DEFAULT_PREFIX = "aetherion:vault:";

  /**
   * Default number of shards per secret.
   */
  int DEFAULT_SHARD_COUNT = 3;

  /**
   * Longest accepted prefix. Slot names must fit the NAME column of the relational store.
   */
  int MAX_PREFIX_LENGTH = 256;

  /**
   * Defaults, in memory.
   *
   * @return the vault configuration
   */
  static VaultConfiguration defaults() {
    return ImmutableVaultConfiguration.builder().build();
  }

  /**
   * Prefix string.
   *
   * @return the string
   */
  @Value.Default
  default String prefix() {
    return DEFAULT_PREFIX;
  }

  /**
   * Number of shards the ciphertext is split into.
   *
   * @return the int
   */
  @Value.Default
  default int shardCount() {
    return DEFAULT_SHARD_COUNT;
  }

  /**
   * When true, a generated keyId that already has slots is discarded and another generated.
   * When false, a keyId that is already in use is overwritten; if that write fails, the slots
   * the keyId held before the write are put back.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean enforceUniqueKeyIds() {
    return true;
  }

  /**
   * How many keyIds to try before giving up.
   *
   * @return the int
   */
  @Value.Default
  default int maxKeyIdAttempts() {
    return 5;
  }

  /**
   * When true, a marker slot is written after the record and required by verification.
   * Stores written without the marker will not verify once this is enabled.
   *
   * @return the boolean
   */
  @Value.Default
  default boolean completionMarker() {
    return false;
  }

  /**
   * Relational store for slots. In memory when absent.
   *
   * @return the optional
   */
  Optional<Database> database();

  /**
   * Validate.
   */
  @Value.Check
  default void validate() {
    if (shardCount() < 1) {
      throw new IllegalArgumentException("shardCount must be at least 1: " + shardCount());
    }
    if (maxKeyIdAttempts() < 1) {
      throw new IllegalArgumentException("maxKeyIdAttempts must be at least 1: " + maxKeyIdAttempts());
    }
    if (prefix().isEmpty()) {
      throw new IllegalArgumentException("prefix must not be empty");
    }
    if (prefix().length() > MAX_PREFIX_LENGTH) {
      throw new IllegalArgumentException("prefix longer than " + MAX_PREFIX_LENGTH + " characters");
    }
  }

}
