package com.codeheadsystems.keystone.server.store;

import com.codeheadsystems.keystone.server.model.Account;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AccountStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Uniqueness is enforced with an atomic {@code putIfAbsent} keyed by email. All accounts are
 * lost on restart. Suitable for development and integration testing only.
 */
public class InMemoryAccountStore implements AccountStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAccountStore.class);

  private final ConcurrentHashMap<String, Account> accountsByEmail = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryAccountStore() {
    this(Clock.systemUTC());
  }

  /**
   * Instantiates a new In memory account store.
   *
   * @param clock source of creation timestamps
   */
  public InMemoryAccountStore(Clock clock) {
    this.clock = clock;
    log.warn("Using InMemoryAccountStore: accounts will NOT survive restarts. "
        + "Replace with a persistent AccountStore for production.");
  }

  @Override
  public Optional<Account> findByEmail(String email) {
    return Optional.ofNullable(accountsByEmail.get(email));
  }

  @Override
  public Account create(String email, String passwordDigest, String name) {
    Account account = new Account(UUID.randomUUID().toString(), email, passwordDigest, name,
        clock.instant());
    if (accountsByEmail.putIfAbsent(email, account) != null) {
      throw new DuplicateEmailException(email);
    }
    log.debug("Stored account {}", account.id());
    return account;
  }
}
