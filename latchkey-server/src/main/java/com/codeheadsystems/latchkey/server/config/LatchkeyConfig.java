package com.codeheadsystems.latchkey.server.config;

import java.time.Duration;

/**
 * Policy settings consumed by the authentication manager.
 *
 * @param usernamePolicy   accepted username shape
 * @param passwordPolicy   required password strength
 * @param resetMaxFailures failed password-reset attempts allowed per username per window
 * @param resetWindow      length of the reset throttling window
 */
public record LatchkeyConfig(
    UsernamePolicy usernamePolicy,
    PasswordPolicy passwordPolicy,
    int resetMaxFailures,
    Duration resetWindow) {

  public static final LatchkeyConfig DEFAULT = new LatchkeyConfig(
      UsernamePolicy.DEFAULT, PasswordPolicy.DEFAULT, 5, Duration.ofMinutes(15));

  public LatchkeyConfig {
    if (resetMaxFailures < 1) {
      throw new IllegalArgumentException("resetMaxFailures must be >= 1");
    }
    if (resetWindow.isNegative() || resetWindow.isZero()) {
      throw new IllegalArgumentException("resetWindow must be positive");
    }
  }
}
