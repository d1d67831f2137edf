package com.codeheadsystems.latchkey.springboot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "latchkey")
public class LatchkeyProperties {

  private String jwtSecretHex = "";
  private String jwtIssuer = "latchkey";
  private long tokenTtlSeconds = 86400;
  private boolean revocationEnabled = true;
  private int usernameMinLength = 3;
  private int usernameMaxLength = 32;
  private int passwordMinLength = 8;
  private boolean passwordRequireUppercase = true;
  private boolean passwordRequireLowercase = true;
  private boolean passwordRequireDigit = true;
  private boolean passwordRequireSymbol = false;
  private int argon2MemoryKib = 65536;
  private int argon2Iterations = 3;
  private int argon2Parallelism = 1;
  private int hashingThreads = Runtime.getRuntime().availableProcessors();
  private int resetMaxFailures = 5;
  private long resetWindowSeconds = 900;

  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  public String getJwtIssuer() {
    return jwtIssuer;
  }

  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  public long getTokenTtlSeconds() {
    return tokenTtlSeconds;
  }

  public void setTokenTtlSeconds(long tokenTtlSeconds) {
    this.tokenTtlSeconds = tokenTtlSeconds;
  }

  public boolean isRevocationEnabled() {
    return revocationEnabled;
  }

  public void setRevocationEnabled(boolean revocationEnabled) {
    this.revocationEnabled = revocationEnabled;
  }

  public int getUsernameMinLength() {
    return usernameMinLength;
  }

  public void setUsernameMinLength(int usernameMinLength) {
    this.usernameMinLength = usernameMinLength;
  }

  public int getUsernameMaxLength() {
    return usernameMaxLength;
  }

  public void setUsernameMaxLength(int usernameMaxLength) {
    this.usernameMaxLength = usernameMaxLength;
  }

  public int getPasswordMinLength() {
    return passwordMinLength;
  }

  public void setPasswordMinLength(int passwordMinLength) {
    this.passwordMinLength = passwordMinLength;
  }

  public boolean isPasswordRequireUppercase() {
    return passwordRequireUppercase;
  }

  public void setPasswordRequireUppercase(boolean passwordRequireUppercase) {
    this.passwordRequireUppercase = passwordRequireUppercase;
  }

  public boolean isPasswordRequireLowercase() {
    return passwordRequireLowercase;
  }

  public void setPasswordRequireLowercase(boolean passwordRequireLowercase) {
    this.passwordRequireLowercase = passwordRequireLowercase;
  }

  public boolean isPasswordRequireDigit() {
    return passwordRequireDigit;
  }

  public void setPasswordRequireDigit(boolean passwordRequireDigit) {
    this.passwordRequireDigit = passwordRequireDigit;
  }

  public boolean isPasswordRequireSymbol() {
    return passwordRequireSymbol;
  }

  public void setPasswordRequireSymbol(boolean passwordRequireSymbol) {
    this.passwordRequireSymbol = passwordRequireSymbol;
  }

  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  public int getHashingThreads() {
    return hashingThreads;
  }

  public void setHashingThreads(int hashingThreads) {
    this.hashingThreads = hashingThreads;
  }

  public int getResetMaxFailures() {
    return resetMaxFailures;
  }

  public void setResetMaxFailures(int resetMaxFailures) {
    this.resetMaxFailures = resetMaxFailures;
  }

  public long getResetWindowSeconds() {
    return resetWindowSeconds;
  }

  public void setResetWindowSeconds(long resetWindowSeconds) {
    this.resetWindowSeconds = resetWindowSeconds;
  }
}
