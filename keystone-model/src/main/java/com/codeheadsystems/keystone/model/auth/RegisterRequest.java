package com.codeheadsystems.keystone.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a new account registration.
 * <p>
 * The password is sent in the clear over the transport (TLS is assumed) and is hashed
 * server-side before anything is stored. It must be at least 8 characters long; the
 * email and name are limited to 255 characters.
 * <p>
 * Used by: {@code POST /api/auth/signup}
 *
 * @param email    the account identifier; must be a syntactically valid email address
 * @param password the plaintext password
 * @param name     optional display name, may be null
 */
public record RegisterRequest(
    @JsonProperty("email") String email,
    @JsonProperty("password") String password,
    @JsonProperty("name") String name) {

  @Override
  public String toString() {
    return "RegisterRequest[email=" + email + ", password=****, name=" + name + "]";
  }
}
