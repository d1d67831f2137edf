package com.codeheadsystems.latchkey.server.model;

import java.util.Arrays;
import java.util.Base64;

/**
 * Output of a password hasher: the random salt and the digest computed over secret and salt.
 * <p>
 * Neither field reveals the secret, but both are still credential material, so
 * {@link #toString()} never prints them.
 *
 * @param salt   per-secret random salt
 * @param digest hash of the secret with {@code salt}
 */
public record HashedSecret(byte[] salt, byte[] digest) {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  public HashedSecret {
    if (salt == null || salt.length == 0) {
      throw new IllegalArgumentException("salt must not be empty");
    }
    if (digest == null || digest.length == 0) {
      throw new IllegalArgumentException("digest must not be empty");
    }
    salt = salt.clone();
    digest = digest.clone();
  }

  /**
   * Rebuilds a hashed secret from its base64 columns.
   *
   * @param saltBase64   base64 salt
   * @param digestBase64 base64 digest
   * @return the hashed secret
   */
  public static HashedSecret fromBase64(String saltBase64, String digestBase64) {
    return new HashedSecret(B64D.decode(saltBase64), B64D.decode(digestBase64));
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  @Override
  public byte[] digest() {
    return digest.clone();
  }

  public String saltBase64() {
    return B64.encodeToString(salt);
  }

  public String digestBase64() {
    return B64.encodeToString(digest);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof HashedSecret other
        && Arrays.equals(salt, other.salt)
        && Arrays.equals(digest, other.digest);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(salt) + Arrays.hashCode(digest);
  }

  @Override
  public String toString() {
    return "HashedSecret[<redacted>]";
  }
}
