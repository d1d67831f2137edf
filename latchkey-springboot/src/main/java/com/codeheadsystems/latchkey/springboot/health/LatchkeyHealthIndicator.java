package com.codeheadsystems.latchkey.springboot.health;

import com.codeheadsystems.latchkey.server.auth.JwtManager;
import com.codeheadsystems.latchkey.server.store.CredentialStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

public class LatchkeyHealthIndicator implements HealthIndicator {

  static final String CHECK_SUBJECT = "latchkey-health-check";

  private final JwtManager jwtManager;
  private final CredentialStore credentialStore;

  public LatchkeyHealthIndicator(JwtManager jwtManager, CredentialStore credentialStore) {
    this.jwtManager = jwtManager;
    this.credentialStore = credentialStore;
  }

  @Override
  public Health health() {
    try {
      String token = jwtManager.issueToken(CHECK_SUBJECT).token();
      if (!CHECK_SUBJECT.equals(jwtManager.verify(token).subject())) {
        return Health.down().withDetail("reason", "Health-check token did not verify").build();
      }
      credentialStore.findByUsername(CHECK_SUBJECT);
    } catch (RuntimeException e) {
      return Health.down(e).build();
    }
    return Health.up()
        .withDetail("tokenTtlSeconds", jwtManager.ttl().toSeconds())
        .withDetail("revocation", jwtManager.supportsRevocation())
        .build();
  }
}
