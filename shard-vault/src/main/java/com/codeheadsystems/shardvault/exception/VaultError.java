package com.codeheadsystems.shardvault.exception;

/**
 * Operational failures a vault caller may need to tell apart. Security relevant failures
 * (missing slots, failed authentication) are never reported through this type.
 */
public enum VaultError {

  /**
   * The storage medium failed (quota, I/O, database unavailable).
   */
  STORAGE_FAILURE,

  /**
   * Every generated keyId was already in use.
   */
  KEY_ID_COLLISION

}
