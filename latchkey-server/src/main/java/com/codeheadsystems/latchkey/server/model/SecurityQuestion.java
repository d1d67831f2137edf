package com.codeheadsystems.latchkey.server.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of security questions an account can be recovered with.
 * <p>
 * Questions are referenced by identifier, never by their text, so answer hashes are always
 * compared for a well-defined question.
 */
public enum SecurityQuestion {

  PET_NAME("What is your pet's name?", "Q_PET"),
  MOTHER_MAIDEN_NAME("What is your mother's maiden name?", "Q_MOTHER"),
  FIRST_CAR("What was your first car?", "Q_CAR"),
  BIRTH_CITY("What city were you born in?", "Q_CITY");

  private final String prompt;
  private final String alias;

  SecurityQuestion(String prompt, String alias) {
    this.prompt = prompt;
    this.alias = alias;
  }

  /**
   * Resolves a question from its identifier or its short alias, ignoring case.
   *
   * @param id e.g. {@code PET_NAME} or {@code Q_PET}
   * @return the question, or empty if {@code id} names none
   */
  public static Optional<SecurityQuestion> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    String normalized = id.trim().toUpperCase(Locale.ROOT);
    for (SecurityQuestion question : values()) {
      if (question.name().equals(normalized) || question.alias.equals(normalized)) {
        return Optional.of(question);
      }
    }
    return Optional.empty();
  }

  public String prompt() {
    return prompt;
  }

  public String alias() {
    return alias;
  }
}
