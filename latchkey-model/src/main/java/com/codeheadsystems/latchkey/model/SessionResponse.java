package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successfully validated session.
 * <p>
 * Used by: {@code POST /auth/session/validate} response
 *
 * @param username the username the token was issued to
 */
public record SessionResponse(
    @JsonProperty("username") String username) {
}
