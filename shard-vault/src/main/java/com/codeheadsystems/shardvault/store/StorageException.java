package com.codeheadsystems.shardvault.store;

/**
 * The storage medium behind a {@link KeyValueStore} failed.
 */
public class StorageException extends RuntimeException {

  /**
   * Instantiates a new Storage exception.
   *
   * @param message the message
   */
  public StorageException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Storage exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public StorageException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
