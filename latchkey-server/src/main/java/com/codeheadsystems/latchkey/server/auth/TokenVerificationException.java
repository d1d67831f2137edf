package com.codeheadsystems.latchkey.server.auth;

/**
 * Thrown by {@link JwtManager#verify(String)} when a token is not valid.
 */
public class TokenVerificationException extends RuntimeException {

  private final TokenFailure failure;

  /**
   * Instantiates a new token verification exception.
   *
   * @param failure the reason
   * @param cause   the underlying library exception, may be null
   */
  public TokenVerificationException(TokenFailure failure, Throwable cause) {
    super(failure.name(), cause);
    this.failure = failure;
  }

  public TokenFailure failure() {
    return failure;
  }
}
