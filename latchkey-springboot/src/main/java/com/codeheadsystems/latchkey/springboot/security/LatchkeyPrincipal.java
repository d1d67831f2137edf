package com.codeheadsystems.latchkey.springboot.security;

import java.security.Principal;

/**
 * The authenticated caller of a request carrying a valid bearer token.
 *
 * @param username the token subject
 * @param jti      the token id
 */
public record LatchkeyPrincipal(String username, String jti) implements Principal {

  @Override
  public String getName() {
    return username;
  }
}
