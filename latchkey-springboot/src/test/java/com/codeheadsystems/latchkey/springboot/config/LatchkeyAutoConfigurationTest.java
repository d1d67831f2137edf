package com.codeheadsystems.latchkey.springboot.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.latchkey.server.auth.JwtManager;
import com.codeheadsystems.latchkey.server.config.LatchkeyConfig;
import com.codeheadsystems.latchkey.server.manager.LatchkeyAuthManager;
import com.codeheadsystems.latchkey.server.manager.LogoutResult;
import com.codeheadsystems.latchkey.server.store.CredentialStore;
import com.codeheadsystems.latchkey.server.store.InMemoryCredentialStore;
import com.codeheadsystems.latchkey.server.store.RevocationStore;
import java.time.Duration;
import java.util.HexFormat;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class LatchkeyAutoConfigurationTest {

  private static final String SECRET_HEX =
      "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(LatchkeyAutoConfiguration.class))
      .withPropertyValues(
          "latchkey.argon2-memory-kib=1024",
          "latchkey.argon2-iterations=1",
          "latchkey.hashing-threads=1");

  @Test
  void defaults_createInMemoryStoreWithRevocation() {
    runner.run(context -> {
      assertThat(context).hasSingleBean(LatchkeyAuthManager.class);
      assertThat(context).hasSingleBean(RevocationStore.class);
      assertThat(context.getBean(CredentialStore.class)).isInstanceOf(InMemoryCredentialStore.class);
      assertThat(context.getBean(JwtManager.class).supportsRevocation()).isTrue();
    });
  }

  @Test
  void revocationDisabled_logoutIsClientDiscard() {
    runner.withPropertyValues("latchkey.revocation-enabled=false").run(context -> {
      assertThat(context).doesNotHaveBean(RevocationStore.class);
      assertThat(context.getBean(JwtManager.class).supportsRevocation()).isFalse();
      assertThat(context.getBean(LatchkeyAuthManager.class).logout("anything"))
          .isEqualTo(LogoutResult.CLIENT_DISCARD);
    });
  }

  @Test
  void suppliedCredentialStore_isUsed() {
    InMemoryCredentialStore store = new InMemoryCredentialStore();
    runner.withBean(CredentialStore.class, () -> store).run(context ->
        assertThat(context.getBean(CredentialStore.class)).isSameAs(store));
  }

  @Test
  void configuredSecret_signsTokens() {
    runner.withPropertyValues(
        "latchkey.jwt-secret-hex=" + SECRET_HEX,
        "latchkey.jwt-issuer=issuer-under-test",
        "latchkey.token-ttl-seconds=600").run(context -> {
          JwtManager configured = context.getBean(JwtManager.class);
          JwtManager independent = new JwtManager(HexFormat.of().parseHex(SECRET_HEX),
              "issuer-under-test", Duration.ofMinutes(10));

          String token = configured.issueToken("alice").token();

          assertThat(configured.ttl()).isEqualTo(Duration.ofMinutes(10));
          assertThat(independent.verify(token).subject()).isEqualTo("alice");
        });
  }

  @Test
  void policyProperties_flowIntoConfig() {
    runner.withPropertyValues(
        "latchkey.username-min-length=5",
        "latchkey.password-min-length=12",
        "latchkey.password-require-symbol=true",
        "latchkey.reset-max-failures=2",
        "latchkey.reset-window-seconds=60").run(context -> {
          LatchkeyConfig config = context.getBean(LatchkeyConfig.class);

          assertThat(config.usernamePolicy().minLength()).isEqualTo(5);
          assertThat(config.passwordPolicy().minLength()).isEqualTo(12);
          assertThat(config.passwordPolicy().maxLength()).isEqualTo(128);
          assertThat(config.passwordPolicy().requireSymbol()).isTrue();
          assertThat(config.resetMaxFailures()).isEqualTo(2);
          assertThat(config.resetWindow()).isEqualTo(Duration.ofMinutes(1));
        });
  }
}
