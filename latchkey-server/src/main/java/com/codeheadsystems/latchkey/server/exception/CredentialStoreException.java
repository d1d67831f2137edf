package com.codeheadsystems.latchkey.server.exception;

/**
 * Infrastructure failure in a credential store (for example a lost database connection).
 * Not a credential outcome: frameworks report it as an internal server error.
 */
public class CredentialStoreException extends RuntimeException {

  public CredentialStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
