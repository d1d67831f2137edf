package com.codeheadsystems.latchkey.server.exception;

/**
 * Thrown by the authentication core for every caller-visible failure.
 * <p>
 * The exception message is the fixed {@link AuthError#message()}; it never carries detail such
 * as which check failed, so it is safe to return as-is.
 */
public class AuthException extends RuntimeException {

  private final AuthError error;

  /**
   * Instantiates a new auth exception.
   *
   * @param error the failure kind
   */
  public AuthException(AuthError error) {
    super(error.message());
    this.error = error;
  }

  public AuthError error() {
    return error;
  }
}
