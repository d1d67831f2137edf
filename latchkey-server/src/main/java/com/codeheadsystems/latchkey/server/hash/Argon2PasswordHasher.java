package com.codeheadsystems.latchkey.server.hash;

import com.codeheadsystems.latchkey.server.model.HashedSecret;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * {@link PasswordHasher} using Argon2id (RFC 9106) from BouncyCastle.
 * <p>
 * Secrets are encoded as UTF-8; the encoded copy is wiped after each computation.
 */
public class Argon2PasswordHasher implements PasswordHasher {

  private final Argon2Settings settings;
  private final SecureRandom random;

  public Argon2PasswordHasher(Argon2Settings settings) {
    this(settings, new SecureRandom());
  }

  /**
   * Instantiates a new Argon2 password hasher.
   *
   * @param settings cost parameters
   * @param random   source of salts
   */
  public Argon2PasswordHasher(Argon2Settings settings, SecureRandom random) {
    this.settings = settings;
    this.random = random;
  }

  @Override
  public HashedSecret hash(String secret) {
    byte[] salt = new byte[settings.saltLength()];
    random.nextBytes(salt);
    return new HashedSecret(salt, hash(secret, salt));
  }

  @Override
  public byte[] hash(String secret, byte[] salt) {
    return derive(secret, salt, settings.hashLength());
  }

  @Override
  public boolean verify(String secret, HashedSecret hashed) {
    byte[] expected = hashed.digest();
    byte[] actual = derive(secret, hashed.salt(), expected.length);
    return MessageDigest.isEqual(expected, actual);
  }

  public Argon2Settings settings() {
    return settings;
  }

  private byte[] derive(String secret, byte[] salt, int length) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(settings.memoryKib())
        .withIterations(settings.iterations())
        .withParallelism(settings.parallelism())
        .build();
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    gen.init(params);
    byte[] input = (secret == null ? "" : secret).getBytes(StandardCharsets.UTF_8);
    try {
      byte[] output = new byte[length];
      gen.generateBytes(input, output, 0, output.length);
      return output;
    } finally {
      Arrays.fill(input, (byte) 0);
    }
  }
}
