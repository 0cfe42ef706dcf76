package com.codeheadsystems.keystone.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model returned after a successful registration or login.
 * <p>
 * The token is an opaque bearer credential; clients send it back in the
 * {@code Authorization: Bearer <token>} header and must not depend on its structure.
 * <p>
 * Used by: {@code POST /api/auth/signup} and {@code POST /api/auth/login} responses
 *
 * @param token signed bearer token for the authenticated account
 * @param user  public view of the authenticated account
 */
public record AuthResponse(
    @JsonProperty("token") String token,
    @JsonProperty("user") AccountView user) {
}
