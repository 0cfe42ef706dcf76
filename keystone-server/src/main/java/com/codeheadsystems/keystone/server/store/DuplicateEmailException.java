package com.codeheadsystems.keystone.server.store;

/**
 * Thrown by {@link AccountStore#create} when the email is already registered.
 */
public class DuplicateEmailException extends RuntimeException {

  /**
   * Instantiates a new Duplicate email exception.
   *
   * @param email the email that was already claimed
   */
  public DuplicateEmailException(String email) {
    super("Email already registered: " + email);
  }

  /**
   * Instantiates a new Duplicate email exception.
   *
   * @param email the email that was already claimed
   * @param cause the storage-level constraint violation
   */
  public DuplicateEmailException(String email, Throwable cause) {
    super("Email already registered: " + email, cause);
  }
}
