package com.codeheadsystems.keystone.server.model;

import com.codeheadsystems.keystone.model.auth.AccountView;
import java.time.Instant;

/**
 * A registered account as held by an {@code AccountStore}.
 * <p>
 * Carries the password digest, so it never leaves the server: use {@link #toView()} for
 * anything returned to a client. {@link #toString()} omits the digest.
 *
 * @param id             server-assigned identifier, never reused
 * @param email          canonical (trimmed, lower-cased) email, unique across accounts
 * @param passwordDigest self-describing password digest
 * @param name           optional display name, may be null
 * @param createdAt      creation time (UTC)
 */
public record Account(
    String id,
    String email,
    String passwordDigest,
    String name,
    Instant createdAt) {

  /**
   * Public projection without the digest.
   *
   * @return the account view
   */
  public AccountView toView() {
    return new AccountView(id, email, name, createdAt.toString());
  }

  @Override
  public String toString() {
    return "Account[id=" + id + ", email=" + email + ", name=" + name
        + ", createdAt=" + createdAt + "]";
  }
}
