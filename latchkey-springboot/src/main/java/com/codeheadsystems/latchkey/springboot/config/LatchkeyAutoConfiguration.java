package com.codeheadsystems.latchkey.springboot.config;

import com.codeheadsystems.latchkey.server.auth.JwtManager;
import com.codeheadsystems.latchkey.server.config.LatchkeyConfig;
import com.codeheadsystems.latchkey.server.config.PasswordPolicy;
import com.codeheadsystems.latchkey.server.config.UsernamePolicy;
import com.codeheadsystems.latchkey.server.hash.Argon2PasswordHasher;
import com.codeheadsystems.latchkey.server.hash.Argon2Settings;
import com.codeheadsystems.latchkey.server.hash.PasswordHasher;
import com.codeheadsystems.latchkey.server.hash.PooledPasswordHasher;
import com.codeheadsystems.latchkey.server.manager.LatchkeyAuthManager;
import com.codeheadsystems.latchkey.server.store.CredentialStore;
import com.codeheadsystems.latchkey.server.store.InMemoryCredentialStore;
import com.codeheadsystems.latchkey.server.store.InMemoryRevocationStore;
import com.codeheadsystems.latchkey.server.store.RevocationStore;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Core beans of the Latchkey authentication service.  Every bean backs off when the application
 * defines its own, so a persistent store is plugged in by declaring a {@link CredentialStore}
 * bean:
 * <pre>{@code
 *   @Bean
 *   public CredentialStore credentialStore(DataSource dataSource) {
 *     JdbcCredentialStore store = new JdbcCredentialStore(dataSource);
 *     store.initializeSchema();
 *     return store;
 *   }
 * }</pre>
 */
@AutoConfiguration
@EnableConfigurationProperties(LatchkeyProperties.class)
public class LatchkeyAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(LatchkeyAutoConfiguration.class);

  /**
   * Default {@link SecureRandom} instance.  Override this bean to supply a custom implementation.
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialStore credentialStore() {
    log.warn("Using in-memory credential store. All accounts will be lost on restart. Do not use in production.");
    return new InMemoryCredentialStore();
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean(RevocationStore.class)
  @ConditionalOnProperty(prefix = "latchkey", name = "revocation-enabled", havingValue = "true",
      matchIfMissing = true)
  public InMemoryRevocationStore revocationStore() {
    return new InMemoryRevocationStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public JwtManager jwtManager(LatchkeyProperties props,
                               ObjectProvider<RevocationStore> revocationStore,
                               SecureRandom secureRandom) {
    String secretHex = props.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured. Generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      secureRandom.nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    RevocationStore revocations = revocationStore.getIfAvailable();
    if (revocations == null) {
      log.warn("Token revocation disabled. Logout cannot invalidate tokens before they expire.");
    }
    return new JwtManager(secret, props.getJwtIssuer(),
        Duration.ofSeconds(props.getTokenTtlSeconds()), revocations, Clock.systemUTC());
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean(PasswordHasher.class)
  public PooledPasswordHasher passwordHasher(LatchkeyProperties props) {
    Argon2Settings settings = Argon2Settings.of(props.getArgon2MemoryKib(),
        props.getArgon2Iterations(), props.getArgon2Parallelism());
    return new PooledPasswordHasher(new Argon2PasswordHasher(settings), props.getHashingThreads());
  }

  @Bean
  @ConditionalOnMissingBean
  public LatchkeyConfig latchkeyConfig(LatchkeyProperties props) {
    UsernamePolicy usernamePolicy =
        new UsernamePolicy(props.getUsernameMinLength(), props.getUsernameMaxLength());
    PasswordPolicy passwordPolicy = new PasswordPolicy(
        props.getPasswordMinLength(),
        Math.max(props.getPasswordMinLength(), PasswordPolicy.DEFAULT.maxLength()),
        props.isPasswordRequireUppercase(),
        props.isPasswordRequireLowercase(),
        props.isPasswordRequireDigit(),
        props.isPasswordRequireSymbol());
    return new LatchkeyConfig(usernamePolicy, passwordPolicy, props.getResetMaxFailures(),
        Duration.ofSeconds(props.getResetWindowSeconds()));
  }

  @Bean
  @ConditionalOnMissingBean
  public LatchkeyAuthManager latchkeyAuthManager(CredentialStore credentialStore,
                                                 PasswordHasher passwordHasher,
                                                 JwtManager jwtManager,
                                                 LatchkeyConfig latchkeyConfig) {
    return new LatchkeyAuthManager(credentialStore, passwordHasher, jwtManager, latchkeyConfig);
  }
}
