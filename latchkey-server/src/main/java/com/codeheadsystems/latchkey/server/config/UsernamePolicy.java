package com.codeheadsystems.latchkey.server.config;

import java.util.regex.Pattern;

/**
 * Shape requirements for usernames: ASCII letters, digits, {@code .}, {@code _} and {@code -},
 * starting with a letter or digit, within the length bounds.
 *
 * @param minLength minimum number of characters
 * @param maxLength maximum number of characters (at most 64, the store's column width)
 */
public record UsernamePolicy(int minLength, int maxLength) {

  public static final UsernamePolicy DEFAULT = new UsernamePolicy(3, 32);

  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

  public UsernamePolicy {
    if (minLength < 1) {
      throw new IllegalArgumentException("minLength must be >= 1");
    }
    if (maxLength < minLength || maxLength > 64) {
      throw new IllegalArgumentException("maxLength must be between minLength and 64");
    }
  }

  public boolean isSatisfiedBy(String username) {
    return username != null
        && username.length() >= minLength
        && username.length() <= maxLength
        && ALLOWED.matcher(username).matches();
  }
}
