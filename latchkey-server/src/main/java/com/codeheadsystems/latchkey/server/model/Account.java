package com.codeheadsystems.latchkey.server.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * A registered user's persisted identity and credential material.
 * <p>
 * Accounts are immutable.  The only change an account ever sees is a password reset, which
 * produces a new instance through {@link #withPassword(HashedSecret)}.
 *
 * @param username         username exactly as registered
 * @param password         salted hash of the password
 * @param securityQuestion the question chosen at sign-up
 * @param securityAnswer   salted hash of the normalized answer
 * @param createdAt        when the account was created
 */
public record Account(
    String username,
    HashedSecret password,
    SecurityQuestion securityQuestion,
    HashedSecret securityAnswer,
    Instant createdAt) {

  public Account {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(securityQuestion, "securityQuestion");
    Objects.requireNonNull(securityAnswer, "securityAnswer");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  /**
   * The key usernames are unique under: usernames differing only in case collide.
   *
   * @param username a username
   * @return its lookup key
   */
  public static String keyOf(String username) {
    return username.toLowerCase(Locale.ROOT);
  }

  public String key() {
    return keyOf(username);
  }

  /**
   * Returns a copy of this account with the password hash replaced.
   *
   * @param newPassword the new password hash
   * @return the updated account
   */
  public Account withPassword(HashedSecret newPassword) {
    return new Account(username, newPassword, securityQuestion, securityAnswer, createdAt);
  }
}
