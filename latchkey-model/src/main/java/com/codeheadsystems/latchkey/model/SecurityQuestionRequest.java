package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for looking up the security question of an account before a password reset.
 * <p>
 * Used by: {@code POST /auth/security-question}
 *
 * @param username the account username
 */
public record SecurityQuestionRequest(
    @JsonProperty("username") String username) {
}
