package com.codeheadsystems.latchkey.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PasswordPolicyTest {

  private final PasswordPolicy policy = PasswordPolicy.DEFAULT;

  @Test
  void acceptsStrongPassword() {
    assertThat(policy.isSatisfiedBy("Str0ngP@ss")).isTrue();
    assertThat(policy.isSatisfiedBy("NewP@ss1")).isTrue();
  }

  @Test
  void reportsEachViolation() {
    assertThat(policy.violations("short")).contains("shorter than 8", "no upper-case letter",
        "no digit");
    assertThat(policy.violations("alllowercase1")).containsExactly("no upper-case letter");
    assertThat(policy.violations("ALLUPPERCASE1")).containsExactly("no lower-case letter");
    assertThat(policy.violations("NoDigitsHere")).containsExactly("no digit");
  }

  @Test
  void nullIsAViolation() {
    assertThat(policy.isSatisfiedBy(null)).isFalse();
  }

  @Test
  void symbolRequiredOnlyWhenConfigured() {
    PasswordPolicy strict = new PasswordPolicy(8, 128, true, true, true, true);

    assertThat(policy.isSatisfiedBy("Password1")).isTrue();
    assertThat(strict.violations("Password1")).containsExactly("no symbol");
    assertThat(strict.isSatisfiedBy("Passw0rd!")).isTrue();
  }

  @Test
  void enforcesMaximumLength() {
    PasswordPolicy bounded = new PasswordPolicy(8, 10, true, true, true, false);

    assertThat(bounded.violations("Abcdefgh123")).containsExactly("longer than 10");
  }

  @Test
  void rejectsInconsistentBounds() {
    assertThatThrownBy(() -> new PasswordPolicy(10, 5, false, false, false, false))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
