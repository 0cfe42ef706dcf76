package com.codeheadsystems.keystone.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a login attempt with an email and password.
 * <p>
 * Used by: {@code POST /api/auth/login}
 *
 * @param email    the account identifier
 * @param password the plaintext password
 */
public record LoginRequest(
    @JsonProperty("email") String email,
    @JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "LoginRequest[email=" + email + ", password=****]";
  }
}
