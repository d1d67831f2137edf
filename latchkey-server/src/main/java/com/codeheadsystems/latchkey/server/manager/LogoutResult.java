package com.codeheadsystems.latchkey.server.manager;

/**
 * What a logout achieved.  Returned to callers so that "logout" never silently means less than
 * it appears to.
 */
public enum LogoutResult {

  REVOKED("Token revoked; it is rejected from now on."),
  NOT_ACTIVE("Token was already expired, revoked, or invalid."),
  CLIENT_DISCARD("Server-side revocation is disabled; the token stays valid until it expires "
      + "and must be discarded by the client.");

  private final String message;

  LogoutResult(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }
}
