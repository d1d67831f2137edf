package com.codeheadsystems.latchkey.server.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Strength requirements for new passwords.
 * <p>
 * The maximum length bounds the work a single request can force onto the hasher.
 *
 * @param minLength        minimum number of characters
 * @param maxLength        maximum number of characters
 * @param requireUppercase at least one upper-case letter
 * @param requireLowercase at least one lower-case letter
 * @param requireDigit     at least one digit
 * @param requireSymbol    at least one character that is neither a letter, a digit nor whitespace
 */
public record PasswordPolicy(
    int minLength,
    int maxLength,
    boolean requireUppercase,
    boolean requireLowercase,
    boolean requireDigit,
    boolean requireSymbol) {

  /**
   * Eight to 128 characters with upper case, lower case, and a digit.
   */
  public static final PasswordPolicy DEFAULT = new PasswordPolicy(8, 128, true, true, true, false);

  public PasswordPolicy {
    if (minLength < 1) {
      throw new IllegalArgumentException("minLength must be >= 1");
    }
    if (maxLength < minLength) {
      throw new IllegalArgumentException("maxLength must be >= minLength");
    }
  }

  /**
   * Lists every rule the password breaks, for diagnostics.
   *
   * @param password the candidate password
   * @return the violated rules; empty if the password is acceptable
   */
  public List<String> violations(String password) {
    List<String> violations = new ArrayList<>();
    if (password == null) {
      violations.add("missing");
      return violations;
    }
    int length = password.codePointCount(0, password.length());
    if (length < minLength) {
      violations.add("shorter than " + minLength);
    }
    if (length > maxLength) {
      violations.add("longer than " + maxLength);
    }
    if (requireUppercase && password.codePoints().noneMatch(Character::isUpperCase)) {
      violations.add("no upper-case letter");
    }
    if (requireLowercase && password.codePoints().noneMatch(Character::isLowerCase)) {
      violations.add("no lower-case letter");
    }
    if (requireDigit && password.codePoints().noneMatch(Character::isDigit)) {
      violations.add("no digit");
    }
    if (requireSymbol && password.codePoints().noneMatch(PasswordPolicy::isSymbol)) {
      violations.add("no symbol");
    }
    return violations;
  }

  public boolean isSatisfiedBy(String password) {
    return violations(password).isEmpty();
  }

  private static boolean isSymbol(int codePoint) {
    return !Character.isLetterOrDigit(codePoint) && !Character.isWhitespace(codePoint);
  }
}
