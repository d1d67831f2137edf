package com.codeheadsystems.latchkey.server.hash;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SecurityAnswersTest {

  @Test
  void trimsAndLowerCases() {
    assertThat(SecurityAnswers.normalize("  Rex ")).isEqualTo("rex");
    assertThat(SecurityAnswers.normalize("REX")).isEqualTo("rex");
  }

  @Test
  void collapsesInternalWhitespace() {
    assertThat(SecurityAnswers.normalize("New \t  York\nCity")).isEqualTo("new york city");
  }

  @Test
  void foldsCompatibilityForms() {
    // full-width letters and a no-break space
    assertThat(SecurityAnswers.normalize("\uFF32\uFF45\uFF58\u00A0Jr")).isEqualTo("rex jr");
  }

  @Test
  void nullAndBlankBecomeEmpty() {
    assertThat(SecurityAnswers.normalize(null)).isEmpty();
    assertThat(SecurityAnswers.normalize(" \t ")).isEmpty();
  }

  @Test
  void keepsPunctuation() {
    assertThat(SecurityAnswers.normalize("O'Brien")).isEqualTo("o'brien");
  }
}
