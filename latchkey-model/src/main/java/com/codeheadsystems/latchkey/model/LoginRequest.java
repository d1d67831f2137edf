package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a password login.
 * <p>
 * Used by: {@code POST /auth/login}
 *
 * @param username the account username (matched case-insensitively)
 * @param password the plaintext password
 */
public record LoginRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password) {

  @Override
  public String toString() {
    return "LoginRequest[username=" + username + "]";
  }
}
