package com.codeheadsystems.keystone.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an account authenticated by a keystone bearer token.
 *
 * @param accountId account identifier from the token subject
 * @param email     account email from the token
 */
public record KeystonePrincipal(String accountId, String email) implements Principal {

  @Override
  public String getName() {
    return accountId;
  }
}
