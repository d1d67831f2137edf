package com.codeheadsystems.latchkey.server.store;

import java.time.Instant;

/**
 * The revocation set: identifiers of tokens invalidated before their natural expiry.
 * <p>
 * Implementations must be thread-safe and independent of the credential store.  The set only
 * grows through {@link #revoke}, and entries whose token has expired carry no information (the
 * token is rejected as expired anyway), so implementations must drop them, either lazily or
 * through {@link #prune(Instant)}.
 */
public interface RevocationStore {

  /**
   * Records a token as revoked.
   *
   * @param jti       the token identifier
   * @param expiresAt when the token expires naturally; the entry may be dropped after this
   */
  void revoke(String jti, Instant expiresAt);

  /**
   * Checks whether a token has been revoked.
   *
   * @param jti the token identifier
   * @return {@code true} if the token was revoked and has not yet expired
   */
  boolean isRevoked(String jti);

  /**
   * Drops every entry whose token expired at or before {@code now}.
   *
   * @param now the current time
   * @return the number of entries removed
   */
  int prune(Instant now);
}
