package com.codeheadsystems.latchkey.server.auth;

/**
 * Why a token was rejected.  Internal diagnostics only: callers always see a single
 * {@code Unauthorized} outcome so the distinction cannot be used as an oracle.
 */
public enum TokenFailure {
  /** Not a well-formed token, or required claims are missing or wrong. */
  MALFORMED,
  /** Signature does not verify under the current key, or the algorithm is not the expected one. */
  INVALID_SIGNATURE,
  /** Signature is valid but the token is past its expiry. */
  EXPIRED,
  /** Signature is valid and unexpired but the token has been revoked. */
  REVOKED
}
