package com.codeheadsystems.latchkey.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.latchkey.server.auth.JwtManager;
import com.codeheadsystems.latchkey.server.store.CredentialStore;

/**
 * Health check that round-trips a throwaway token and queries the credential store.
 */
public class LatchkeyHealthCheck extends HealthCheck {

  static final String CHECK_SUBJECT = "latchkey-health-check";

  private final JwtManager jwtManager;
  private final CredentialStore credentialStore;

  /**
   * Instantiates a new Latchkey health check.
   *
   * @param jwtManager      the token service
   * @param credentialStore the account store
   */
  public LatchkeyHealthCheck(JwtManager jwtManager, CredentialStore credentialStore) {
    this.jwtManager = jwtManager;
    this.credentialStore = credentialStore;
  }

  @Override
  protected Result check() {
    String token = jwtManager.issueToken(CHECK_SUBJECT).token();
    if (!CHECK_SUBJECT.equals(jwtManager.verify(token).subject())) {
      return Result.unhealthy("Health-check token did not verify");
    }
    // throws CredentialStoreException if the store is unreachable
    credentialStore.findByUsername(CHECK_SUBJECT);
    return Result.healthy("token ttl=%ds", jwtManager.ttl().toSeconds());
  }
}
