package com.codeheadsystems.shardvault.model;

import java.util.List;
import org.immutables.value.Value;

/**
 * The pieces of one stored secret, as held in memory between encryption and persistence.
 * Never persisted as a unit; each piece has its own slot.
 */
@Value.Immutable
public interface SecretRecord {

  /**
   * Of secret record.
   *
   * @param keyId         the key id
   * @param encryptionKey base64 encoded AES key
   * @param shards        the shards, in order
   * @return the secret record
   */
  static SecretRecord of(final String keyId, final String encryptionKey, final List<String> shards) {
    return ImmutableSecretRecord.builder()
        .keyId(keyId)
        .encryptionKey(encryptionKey)
        .shards(shards)
        .build();
  }

  /**
   * Key id.
   *
   * @return the string
   */
  String keyId();

  /**
   * Base64 encoded raw AES-256 key.
   *
   * @return the string
   */
  @Value.Redacted
  String encryptionKey();

  /**
   * Contiguous pieces of the base64 encoded IV and ciphertext.
   *
   * @return the list
   */
  @Value.Redacted
  List<String> shards();

}
