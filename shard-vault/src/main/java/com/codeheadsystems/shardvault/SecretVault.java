package com.codeheadsystems.shardvault;

import com.codeheadsystems.shardvault.exception.VaultException;
import java.util.Optional;

/**
 * Stores secrets (API keys, credentials) encrypted and split across independent storage slots.
 *
 * <p>The encryption key lives in the same storage medium as the ciphertext shards. Confidentiality
 * therefore rests on the access control of that medium; splitting is obfuscation, not secret
 * sharing. Losing any one slot makes the secret unrecoverable.
 *
 * <p>Calls against the same keyId are not synchronized with each other. Callers that race a
 * retrieve against a delete must serialize them.
 */
public interface SecretVault {

  /**
   * Encrypts and stores the secret under a newly generated keyId.
   *
   * @param service free-form label used to build the keyId. Not security sensitive.
   * @param secret  the value to protect.
   * @return the keyId to retrieve the secret with.
   * @throws VaultException if the storage medium fails, or no unused keyId could be generated.
   */
  String storeKey(String service, String secret);

  /**
   * Reads and decrypts a secret. Missing slots, tampered data and a wrong key all look the same.
   *
   * @param keyId the id returned by {@link #storeKey(String, String)}.
   * @return the secret, or empty if it cannot be reconstructed.
   * @throws VaultException if the storage medium itself fails.
   */
  Optional<String> retrieveKey(String keyId);

  /**
   * Checks that every slot of the record exists. Does not decrypt.
   *
   * @param keyId the key id.
   * @return true if the record is complete.
   * @throws VaultException if the storage medium itself fails.
   */
  boolean verifyKey(String keyId);

  /**
   * Removes every slot of the record. Deleting an unknown keyId succeeds.
   *
   * @param keyId the key id.
   * @return false only if the storage medium failed.
   */
  boolean deleteKey(String keyId);

}
