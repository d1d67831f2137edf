package com.codeheadsystems.latchkey.server.hash;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization applied to security answers before they are hashed or verified.
 * <p>
 * Users recall free-text answers inconsistently, so an answer is reduced to a canonical form:
 * <ol>
 *   <li>Unicode NFKC normalization (full-width and composed forms fold together),</li>
 *   <li>leading and trailing whitespace removed,</li>
 *   <li>every internal run of whitespace replaced by a single space,</li>
 *   <li>lower-cased with {@link Locale#ROOT}.</li>
 * </ol>
 * {@code "  Rex "}, {@code "rex"} and {@code "REX"} all normalize to {@code "rex"}.
 */
public final class SecurityAnswers {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private SecurityAnswers() {
  }

  /**
   * Normalizes an answer.
   *
   * @param answer the raw answer; {@code null} is treated as empty
   * @return the canonical form
   */
  public static String normalize(String answer) {
    if (answer == null) {
      return "";
    }
    String folded = Normalizer.normalize(answer, Normalizer.Form.NFKC).strip();
    return WHITESPACE.matcher(folded).replaceAll(" ").toLowerCase(Locale.ROOT);
  }
}
