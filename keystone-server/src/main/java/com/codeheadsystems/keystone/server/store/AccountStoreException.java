package com.codeheadsystems.keystone.server.store;

/**
 * Infrastructure failure inside an {@link AccountStore}, e.g. the database is unreachable.
 * The request was never evaluated, so callers must not treat this as a credential failure.
 */
public class AccountStoreException extends RuntimeException {

  /**
   * Instantiates a new Account store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public AccountStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
