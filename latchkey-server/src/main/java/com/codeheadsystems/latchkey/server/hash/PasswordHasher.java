package com.codeheadsystems.latchkey.server.hash;

import com.codeheadsystems.latchkey.server.model.HashedSecret;

/**
 * One-way, salted hashing of secrets (login passwords and normalized security answers).
 * <p>
 * Implementations must be deliberately slow, deterministic for a given secret and salt, and
 * must verify in constant time with respect to where a mismatch occurs.
 */
public interface PasswordHasher {

  /**
   * Hashes a secret under a freshly generated random salt.  Every call draws a new salt, so two
   * secrets never share one.
   *
   * @param secret the plaintext secret
   * @return the salt and digest
   */
  HashedSecret hash(String secret);

  /**
   * Hashes a secret under the given salt.
   *
   * @param secret the plaintext secret
   * @param salt   the salt
   * @return the digest
   */
  byte[] hash(String secret, byte[] salt);

  /**
   * Recomputes the digest of {@code secret} under the stored salt and compares it with the
   * stored digest in constant time.
   *
   * @param secret the candidate plaintext secret
   * @param hashed the stored salt and digest
   * @return {@code true} if the secret matches
   */
  boolean verify(String secret, HashedSecret hashed);
}
