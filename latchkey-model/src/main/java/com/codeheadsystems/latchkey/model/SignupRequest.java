package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for account registration.
 * <p>
 * The security question is sent by identifier (for example {@code PET_NAME}); the answer is
 * free text and is normalized by the server before hashing, so callers should pass it exactly
 * as the user typed it.
 * <p>
 * Used by: {@code POST /auth/signup}
 *
 * @param username         requested username; uniqueness is case-insensitive
 * @param password         plaintext password, checked against the server's password policy
 * @param securityQuestion identifier of one of the server's fixed security questions
 * @param securityAnswer   plaintext answer to the security question
 */
public record SignupRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password,
    @JsonProperty("securityQuestion") String securityQuestion,
    @JsonProperty("securityAnswer") String securityAnswer) {

  @Override
  public String toString() {
    return "SignupRequest[username=" + username + ", securityQuestion=" + securityQuestion + "]";
  }
}
