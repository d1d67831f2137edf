package com.codeheadsystems.latchkey.server.exception;

/**
 * Coarse failure kinds reported to callers of the authentication core.
 * <p>
 * The kinds are deliberately collapsed: {@link #INVALID_CREDENTIALS} covers both an unknown
 * username and a wrong secret, and {@link #UNAUTHORIZED} covers every reason a token can be
 * rejected.  Diagnostic detail is logged, never returned.
 */
public enum AuthError {

  INVALID_USERNAME("InvalidUsername", 400, "Username does not meet the username policy"),
  WEAK_PASSWORD("WeakPassword", 400, "Password does not meet the password policy"),
  DUPLICATE_USERNAME("DuplicateUsername", 409, "Username is already taken"),
  INVALID_CREDENTIALS("InvalidCredentials", 401, "Invalid credentials"),
  UNAUTHORIZED("Unauthorized", 401, "Unauthorized"),
  INVALID_REQUEST("InvalidRequest", 400, "Request is missing or has invalid fields");

  private final String wireName;
  private final int httpStatus;
  private final String message;

  AuthError(String wireName, int httpStatus, String message) {
    this.wireName = wireName;
    this.httpStatus = httpStatus;
    this.message = message;
  }

  /**
   * Name used in {@code ErrorResponse.error}.
   *
   * @return the wire name
   */
  public String wireName() {
    return wireName;
  }

  public int httpStatus() {
    return httpStatus;
  }

  /**
   * Fixed message safe to show to the caller.
   *
   * @return the message
   */
  public String message() {
    return message;
  }
}
