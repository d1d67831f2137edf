package com.codeheadsystems.latchkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model carrying a session token.
 * <p>
 * Used by: {@code POST /auth/session/validate}, {@code POST /auth/logout}
 *
 * @param token the session token returned by login
 */
public record TokenRequest(
    @JsonProperty("token") String token) {

  @Override
  public String toString() {
    return "TokenRequest[token=<redacted>]";
  }
}
