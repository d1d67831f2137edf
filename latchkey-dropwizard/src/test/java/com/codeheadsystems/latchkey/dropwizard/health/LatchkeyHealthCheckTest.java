package com.codeheadsystems.latchkey.dropwizard.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codahale.metrics.health.HealthCheck.Result;
import com.codeheadsystems.latchkey.server.auth.JwtManager;
import com.codeheadsystems.latchkey.server.exception.CredentialStoreException;
import com.codeheadsystems.latchkey.server.store.CredentialStore;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LatchkeyHealthCheckTest {

  private static final byte[] SECRET =
      "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);

  @Mock private CredentialStore credentialStore;

  private LatchkeyHealthCheck healthCheck;

  @BeforeEach
  void setUp() {
    healthCheck = new LatchkeyHealthCheck(
        new JwtManager(SECRET, "test-issuer", Duration.ofHours(1)), credentialStore);
  }

  @Test
  void healthy() {
    when(credentialStore.findByUsername(LatchkeyHealthCheck.CHECK_SUBJECT))
        .thenReturn(Optional.empty());

    Result result = healthCheck.execute();

    assertThat(result.isHealthy()).isTrue();
    assertThat(result.getMessage()).isEqualTo("token ttl=3600s");
  }

  @Test
  void unreachableStore_isUnhealthy() {
    when(credentialStore.findByUsername(LatchkeyHealthCheck.CHECK_SUBJECT))
        .thenThrow(new CredentialStoreException("Failed to load account", new SQLException("down")));

    Result result = healthCheck.execute();

    assertThat(result.isHealthy()).isFalse();
  }
}
