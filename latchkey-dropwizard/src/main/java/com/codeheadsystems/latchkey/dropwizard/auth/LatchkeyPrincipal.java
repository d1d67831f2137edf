package com.codeheadsystems.latchkey.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an authenticated Latchkey user.
 *
 * @param username the JWT subject
 * @param jti      JWT ID of the presented session token
 */
public record LatchkeyPrincipal(String username, String jti) implements Principal {

  @Override
  public String getName() {
    return username;
  }
}
