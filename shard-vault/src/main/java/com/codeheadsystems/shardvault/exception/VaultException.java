package com.codeheadsystems.shardvault.exception;

/**
 * Thrown by the vault for operational failures.
 */
public class VaultException extends RuntimeException {

  private final VaultError error;

  /**
   * Instantiates a new Vault exception.
   *
   * @param error   the error
   * @param message the message
   */
  public VaultException(final VaultError error, final String message) {
    super(message);
    this.error = error;
  }

  /**
   * Instantiates a new Vault exception.
   *
   * @param error   the error
   * @param message the message
   * @param cause   the cause
   */
  public VaultException(final VaultError error, final String message, final Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  /**
   * Error vault error.
   *
   * @return the vault error
   */
  public VaultError error() {
    return error;
  }
}
