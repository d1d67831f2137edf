package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a password reset via security question.
 * <p>
 * Used by: {@code POST /auth/password/reset}
 *
 * @param username       the account username
 * @param securityAnswer plaintext answer to the account's security question
 * @param newPassword    plaintext replacement password
 */
public record ResetPasswordRequest(
    @JsonProperty("username") String username,
    @JsonProperty("securityAnswer") String securityAnswer,
    @JsonProperty("newPassword") String newPassword) {

  @Override
  public String toString() {
    return "ResetPasswordRequest[username=" + username + "]";
  }
}
