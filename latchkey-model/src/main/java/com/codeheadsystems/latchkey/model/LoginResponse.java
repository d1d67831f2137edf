package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successful login.
 * <p>
 * The token is a signed bearer credential.  Present it as {@code Authorization: Bearer <token>}
 * to protected endpoints, or in a {@link TokenRequest} to {@code /auth/session/validate} and
 * {@code /auth/logout}.
 * <p>
 * Used by: {@code POST /auth/login} response
 *
 * @param token     signed session token
 * @param expiresAt ISO-8601 instant after which the token is no longer accepted
 */
public record LoginResponse(
    @JsonProperty("token") String token,
    @JsonProperty("expiresAt") String expiresAt) {

  @Override
  public String toString() {
    return "LoginResponse[expiresAt=" + expiresAt + "]";
  }
}
