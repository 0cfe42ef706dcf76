package com.codeheadsystems.keystone.server.store;

import com.codeheadsystems.keystone.server.model.Account;
import java.util.Optional;

/**
 * Storage abstraction for accounts.
 * <p>
 * The store is the authority on email uniqueness: {@link #create} must fail with
 * {@link DuplicateEmailException} whenever the email is already claimed, including when a
 * concurrent insert claimed it a moment earlier. A lookup followed by an insert is not enough;
 * back it with a unique constraint (unique index, atomic put-if-absent, etc.).
 * <p>
 * Implementations must be thread-safe. Infrastructure failures are reported as
 * {@link AccountStoreException}.
 */
public interface AccountStore {

  /**
   * Looks an account up by its stored email. Exact match, no normalisation.
   *
   * @param email canonical email
   * @return the account, or empty if no account has this email
   */
  Optional<Account> findByEmail(String email);

  /**
   * Creates an account, assigning its identifier and creation time.
   *
   * @param email          canonical email
   * @param passwordDigest digest of the account's password
   * @param name           optional display name, may be null
   * @return the stored account
   * @throws DuplicateEmailException if the email is already registered
   */
  Account create(String email, String passwordDigest, String name);
}
