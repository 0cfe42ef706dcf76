package com.codeheadsystems.keystone.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public projection of an account. Never carries the password digest.
 *
 * @param id        server-assigned account identifier
 * @param email     the account's email address, as stored
 * @param name      optional display name, may be null
 * @param createdAt ISO-8601 UTC creation timestamp
 */
public record AccountView(
    @JsonProperty("id") String id,
    @JsonProperty("email") String email,
    @JsonProperty("name") String name,
    @JsonProperty("created_at") String createdAt) {
}
