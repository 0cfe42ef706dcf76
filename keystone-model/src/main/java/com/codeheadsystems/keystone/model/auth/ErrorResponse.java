package com.codeheadsystems.keystone.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by the auth endpoints.
 *
 * @param detail human readable reason for the failure
 */
public record ErrorResponse(@JsonProperty("detail") String detail) {
}
