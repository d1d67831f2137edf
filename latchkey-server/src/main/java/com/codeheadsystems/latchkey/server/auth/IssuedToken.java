package com.codeheadsystems.latchkey.server.auth;

import java.time.Instant;

/**
 * A freshly signed session token and its claims.
 *
 * @param token     the signed JWT
 * @param subject   the username it authenticates
 * @param jti       the token identifier
 * @param issuedAt  issue time
 * @param expiresAt expiry time
 */
public record IssuedToken(String token, String subject, String jti, Instant issuedAt, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedToken[subject=" + subject + ", jti=" + jti + ", expiresAt=" + expiresAt + "]";
  }
}
