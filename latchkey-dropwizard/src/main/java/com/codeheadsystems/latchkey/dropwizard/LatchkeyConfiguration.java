package com.codeheadsystems.latchkey.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the Latchkey authentication endpoints.
 * <p>
 * For production, supply {@code jwtSecretHex} (a hex-encoded random value of at least 32 bytes)
 * so that session tokens survive restarts, and a {@code database} block so that accounts do.
 * Omitting either falls back to a random secret or an in-memory store (dev/test only).
 * <p>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class LatchkeyConfiguration extends Configuration {
  /**
   * Hex-encoded HMAC-SHA256 signing secret for session tokens, at least 32 bytes.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "latchkey";

  /**
   * Session token time-to-live in seconds.
   */
  @Min(1)
  private long tokenTtlSeconds = 86400;

  /**
   * Whether logout revokes tokens server-side.  When disabled, logout only tells the
   * client to discard its token, which stays valid until it expires.
   */
  private boolean revocationEnabled = true;

  /**
   * Minimum username length.
   */
  @Min(1)
  private int usernameMinLength = 3;

  /**
   * Maximum username length, at most 64.
   */
  @Min(1)
  @Max(64)
  private int usernameMaxLength = 32;

  /**
   * Minimum password length.
   */
  @Min(1)
  private int passwordMinLength = 8;

  /**
   * Whether passwords need an upper-case letter.
   */
  private boolean passwordRequireUppercase = true;

  /**
   * Whether passwords need a lower-case letter.
   */
  private boolean passwordRequireLowercase = true;

  /**
   * Whether passwords need a digit.
   */
  private boolean passwordRequireDigit = true;

  /**
   * Whether passwords need a symbol.
   */
  private boolean passwordRequireSymbol = false;

  /**
   * Argon2id memory cost in kibibytes.
   */
  @Min(8)
  private int argon2MemoryKib = 65536;

  /**
   * Argon2id iteration count.
   */
  @Min(1)
  private int argon2Iterations = 3;

  /**
   * Argon2id parallelism.
   */
  @Min(1)
  private int argon2Parallelism = 1;

  /**
   * Number of threads computing password hashes.  Caps the memory Argon2id can use at
   * once to {@code hashingThreads * argon2MemoryKib}.
   */
  @Min(1)
  private int hashingThreads = Runtime.getRuntime().availableProcessors();

  /**
   * Failed password-reset attempts allowed per username within the reset window.
   */
  @Min(1)
  private int resetMaxFailures = 5;

  /**
   * Length of the password-reset throttling window in seconds.
   */
  @Min(1)
  private long resetWindowSeconds = 900;

  /**
   * JDBC connection for the account table.  Leave unset to keep accounts in memory
   * (dev only, accounts are lost on restart).
   */
  @Valid
  private DataSourceFactory database;

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets token ttl seconds.
   *
   * @return the token ttl seconds
   */
  @JsonProperty
  public long getTokenTtlSeconds() {
    return tokenTtlSeconds;
  }

  /**
   * Sets token ttl seconds.
   *
   * @param tokenTtlSeconds the token ttl seconds
   */
  @JsonProperty
  public void setTokenTtlSeconds(long tokenTtlSeconds) {
    this.tokenTtlSeconds = tokenTtlSeconds;
  }

  /**
   * Gets revocation enabled.
   *
   * @return the revocation enabled
   */
  @JsonProperty
  public boolean isRevocationEnabled() {
    return revocationEnabled;
  }

  /**
   * Sets revocation enabled.
   *
   * @param revocationEnabled the revocation enabled
   */
  @JsonProperty
  public void setRevocationEnabled(boolean revocationEnabled) {
    this.revocationEnabled = revocationEnabled;
  }

  /**
   * Gets username min length.
   *
   * @return the username min length
   */
  @JsonProperty
  public int getUsernameMinLength() {
    return usernameMinLength;
  }

  /**
   * Sets username min length.
   *
   * @param usernameMinLength the username min length
   */
  @JsonProperty
  public void setUsernameMinLength(int usernameMinLength) {
    this.usernameMinLength = usernameMinLength;
  }

  /**
   * Gets username max length.
   *
   * @return the username max length
   */
  @JsonProperty
  public int getUsernameMaxLength() {
    return usernameMaxLength;
  }

  /**
   * Sets username max length.
   *
   * @param usernameMaxLength the username max length
   */
  @JsonProperty
  public void setUsernameMaxLength(int usernameMaxLength) {
    this.usernameMaxLength = usernameMaxLength;
  }

  /**
   * Gets password min length.
   *
   * @return the password min length
   */
  @JsonProperty
  public int getPasswordMinLength() {
    return passwordMinLength;
  }

  /**
   * Sets password min length.
   *
   * @param passwordMinLength the password min length
   */
  @JsonProperty
  public void setPasswordMinLength(int passwordMinLength) {
    this.passwordMinLength = passwordMinLength;
  }

  /**
   * Gets password require uppercase.
   *
   * @return the password require uppercase
   */
  @JsonProperty
  public boolean isPasswordRequireUppercase() {
    return passwordRequireUppercase;
  }

  /**
   * Sets password require uppercase.
   *
   * @param passwordRequireUppercase the password require uppercase
   */
  @JsonProperty
  public void setPasswordRequireUppercase(boolean passwordRequireUppercase) {
    this.passwordRequireUppercase = passwordRequireUppercase;
  }

  /**
   * Gets password require lowercase.
   *
   * @return the password require lowercase
   */
  @JsonProperty
  public boolean isPasswordRequireLowercase() {
    return passwordRequireLowercase;
  }

  /**
   * Sets password require lowercase.
   *
   * @param passwordRequireLowercase the password require lowercase
   */
  @JsonProperty
  public void setPasswordRequireLowercase(boolean passwordRequireLowercase) {
    this.passwordRequireLowercase = passwordRequireLowercase;
  }

  /**
   * Gets password require digit.
   *
   * @return the password require digit
   */
  @JsonProperty
  public boolean isPasswordRequireDigit() {
    return passwordRequireDigit;
  }

  /**
   * Sets password require digit.
   *
   * @param passwordRequireDigit the password require digit
   */
  @JsonProperty
  public void setPasswordRequireDigit(boolean passwordRequireDigit) {
    this.passwordRequireDigit = passwordRequireDigit;
  }

  /**
   * Gets password require symbol.
   *
   * @return the password require symbol
   */
  @JsonProperty
  public boolean isPasswordRequireSymbol() {
    return passwordRequireSymbol;
  }

  /**
   * Sets password require symbol.
   *
   * @param passwordRequireSymbol the password require symbol
   */
  @JsonProperty
  public void setPasswordRequireSymbol(boolean passwordRequireSymbol) {
    this.passwordRequireSymbol = passwordRequireSymbol;
  }

  /**
   * Gets argon 2 memory kib.
   *
   * @return the argon 2 memory kib
   */
  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  /**
   * Sets argon 2 memory kib.
   *
   * @param argon2MemoryKib the argon 2 memory kib
   */
  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  /**
   * Gets argon 2 iterations.
   *
   * @return the argon 2 iterations
   */
  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  /**
   * Sets argon 2 iterations.
   *
   * @param argon2Iterations the argon 2 iterations
   */
  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  /**
   * Gets argon 2 parallelism.
   *
   * @return the argon 2 parallelism
   */
  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  /**
   * Sets argon 2 parallelism.
   *
   * @param argon2Parallelism the argon 2 parallelism
   */
  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  /**
   * Gets hashing threads.
   *
   * @return the hashing threads
   */
  @JsonProperty
  public int getHashingThreads() {
    return hashingThreads;
  }

  /**
   * Sets hashing threads.
   *
   * @param hashingThreads the hashing threads
   */
  @JsonProperty
  public void setHashingThreads(int hashingThreads) {
    this.hashingThreads = hashingThreads;
  }

  /**
   * Gets reset max failures.
   *
   * @return the reset max failures
   */
  @JsonProperty
  public int getResetMaxFailures() {
    return resetMaxFailures;
  }

  /**
   * Sets reset max failures.
   *
   * @param resetMaxFailures the reset max failures
   */
  @JsonProperty
  public void setResetMaxFailures(int resetMaxFailures) {
    this.resetMaxFailures = resetMaxFailures;
  }

  /**
   * Gets reset window seconds.
   *
   * @return the reset window seconds
   */
  @JsonProperty
  public long getResetWindowSeconds() {
    return resetWindowSeconds;
  }

  /**
   * Sets reset window seconds.
   *
   * @param resetWindowSeconds the reset window seconds
   */
  @JsonProperty
  public void setResetWindowSeconds(long resetWindowSeconds) {
    this.resetWindowSeconds = resetWindowSeconds;
  }

  /**
   * Gets database.
   *
   * @return the database
   */
  @JsonProperty
  public DataSourceFactory getDatabase() {
    return database;
  }

  /**
   * Sets database.
   *
   * @param database the database
   */
  @JsonProperty
  public void setDatabase(DataSourceFactory database) {
    this.database = database;
  }
}
