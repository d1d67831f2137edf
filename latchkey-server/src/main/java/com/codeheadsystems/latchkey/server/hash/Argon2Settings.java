package com.codeheadsystems.latchkey.server.hash;

/**
 * Argon2id cost parameters and output sizes.
 *
 * @param memoryKib   memory cost in kibibytes
 * @param iterations  number of passes over memory
 * @param parallelism number of lanes
 * @param hashLength  digest length in bytes
 * @param saltLength  salt length in bytes
 */
public record Argon2Settings(
    int memoryKib,
    int iterations,
    int parallelism,
    int hashLength,
    int saltLength) {

  /**
   * Production defaults: 64 MiB, 3 passes, 1 lane, 32-byte digest, 16-byte salt.
   */
  public static final Argon2Settings DEFAULT = new Argon2Settings(65536, 3, 1, 32, 16);

  public Argon2Settings {
    if (memoryKib < 8 * parallelism) {
      throw new IllegalArgumentException("memoryKib must be at least 8 * parallelism");
    }
    if (iterations < 1) {
      throw new IllegalArgumentException("iterations must be >= 1");
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1");
    }
    if (hashLength < 16) {
      throw new IllegalArgumentException("hashLength must be >= 16");
    }
    if (saltLength < 16) {
      throw new IllegalArgumentException("saltLength must be >= 16");
    }
  }

  /**
   * Builds settings with the default digest and salt lengths.
   *
   * @param memoryKib   memory cost in kibibytes
   * @param iterations  number of passes
   * @param parallelism number of lanes
   * @return the settings
   */
  public static Argon2Settings of(int memoryKib, int iterations, int parallelism) {
    return new Argon2Settings(memoryKib, iterations, parallelism,
        DEFAULT.hashLength(), DEFAULT.saltLength());
  }

  /**
   * Cheap settings for unit tests. Do not use in production.
   *
   * @return low-cost settings
   */
  public static Argon2Settings forTesting() {
    return of(1024, 1, 1);
  }
}
