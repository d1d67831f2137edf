package com.codeheadsystems.latchkey.dropwizard;

import com.codeheadsystems.latchkey.dropwizard.auth.LatchkeyAuthenticator;
import com.codeheadsystems.latchkey.dropwizard.auth.LatchkeyPrincipal;
import com.codeheadsystems.latchkey.dropwizard.health.LatchkeyHealthCheck;
import com.codeheadsystems.latchkey.server.auth.JwtManager;
import com.codeheadsystems.latchkey.server.config.LatchkeyConfig;
import com.codeheadsystems.latchkey.server.config.PasswordPolicy;
import com.codeheadsystems.latchkey.server.config.UsernamePolicy;
import com.codeheadsystems.latchkey.server.hash.Argon2PasswordHasher;
import com.codeheadsystems.latchkey.server.hash.Argon2Settings;
import com.codeheadsystems.latchkey.server.hash.PooledPasswordHasher;
import com.codeheadsystems.latchkey.server.manager.LatchkeyAuthManager;
import com.codeheadsystems.latchkey.server.resource.AuthExceptionMapper;
import com.codeheadsystems.latchkey.server.resource.AuthResource;
import com.codeheadsystems.latchkey.server.store.CredentialStore;
import com.codeheadsystems.latchkey.server.store.InMemoryCredentialStore;
import com.codeheadsystems.latchkey.server.store.InMemoryRevocationStore;
import com.codeheadsystems.latchkey.server.store.JdbcCredentialStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.ManagedDataSource;
import io.dropwizard.lifecycle.Managed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the Latchkey authentication core into an existing Dropwizard
 * application.
 * <p>
 * Registers the {@code /auth} JAX-RS resource and its exception mapper, a health check, and a
 * bearer-token authentication filter so application resources can take
 * {@code @Auth LatchkeyPrincipal}.  Requires a {@link LatchkeyConfiguration} as the
 * application's configuration.
 * <p>
 * Embed in your application:
 * <pre>{@code
 *   bootstrap.addBundle(new LatchkeyBundle<>());
 * }</pre>
 * Accounts are kept in the configured {@code database}, or in memory when none is configured.
 * <p>
 * Or supply your own store:
 * <pre>{@code
 *   bootstrap.addBundle(new LatchkeyBundle<>(myCredentialStore));
 * }</pre>
 */
@Singleton
public class LatchkeyBundle<C extends LatchkeyConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(LatchkeyBundle.class);

  private final CredentialStore suppliedStore;

  private LatchkeyAuthManager manager;
  private JwtManager jwtManager;

  /**
   * Creates a bundle that builds its credential store from the configuration.
   */
  public LatchkeyBundle() {
    this.suppliedStore = null;
  }

  /**
   * Creates a bundle backed by the supplied credential store.  The {@code database}
   * configuration block is ignored.
   *
   * @param credentialStore the account store
   */
  @Inject
  public LatchkeyBundle(CredentialStore credentialStore) {
    this.suppliedStore = credentialStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    CredentialStore credentialStore = buildCredentialStore(configuration, environment);

    InMemoryRevocationStore revocationStore =
        configuration.isRevocationEnabled() ? new InMemoryRevocationStore() : null;
    jwtManager = buildJwtManager(configuration, revocationStore);

    Argon2Settings settings = Argon2Settings.of(configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(), configuration.getArgon2Parallelism());
    PooledPasswordHasher hasher = new PooledPasswordHasher(
        new Argon2PasswordHasher(settings), configuration.getHashingThreads());

    manager = new LatchkeyAuthManager(credentialStore, hasher, jwtManager,
        buildLatchkeyConfig(configuration));
    environment.lifecycle().manage(new Managed() {
      @Override
      public void start() {
        // nothing to start
      }

      @Override
      public void stop() {
        hasher.shutdown();
        if (revocationStore != null) {
          revocationStore.shutdown();
        }
      }
    });

    environment.jersey().register(new AuthResource(manager));
    environment.jersey().register(new AuthExceptionMapper());
    environment.healthChecks().register("latchkey",
        new LatchkeyHealthCheck(jwtManager, credentialStore));

    // JWT auth filter
    LatchkeyAuthenticator authenticator = new LatchkeyAuthenticator(jwtManager);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<LatchkeyPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(LatchkeyPrincipal.class));
  }

  /**
   * The manager built by {@link #run}, for applications that call the core directly.
   *
   * @return the authentication manager, or {@code null} before the bundle has run
   */
  public LatchkeyAuthManager getManager() {
    return manager;
  }

  /**
   * The token service built by {@link #run}.
   *
   * @return the JWT manager, or {@code null} before the bundle has run
   */
  public JwtManager getJwtManager() {
    return jwtManager;
  }

  private CredentialStore buildCredentialStore(C configuration, Environment environment) {
    if (suppliedStore != null) {
      return suppliedStore;
    }
    if (configuration.getDatabase() == null) {
      return new InMemoryCredentialStore();
    }
    ManagedDataSource dataSource =
        configuration.getDatabase().build(environment.metrics(), "latchkey");
    environment.lifecycle().manage(dataSource);
    JdbcCredentialStore store = new JdbcCredentialStore(dataSource);
    store.initializeSchema();
    return store;
  }

  private JwtManager buildJwtManager(C configuration, InMemoryRevocationStore revocationStore) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured. Generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    if (revocationStore == null) {
      log.warn("Token revocation disabled. Logout cannot invalidate tokens before they expire.");
    }
    return new JwtManager(secret, configuration.getJwtIssuer(),
        Duration.ofSeconds(configuration.getTokenTtlSeconds()), revocationStore,
        Clock.systemUTC());
  }

  private static LatchkeyConfig buildLatchkeyConfig(LatchkeyConfiguration configuration) {
    UsernamePolicy usernamePolicy = new UsernamePolicy(
        configuration.getUsernameMinLength(), configuration.getUsernameMaxLength());
    PasswordPolicy passwordPolicy = new PasswordPolicy(
        configuration.getPasswordMinLength(),
        Math.max(configuration.getPasswordMinLength(), PasswordPolicy.DEFAULT.maxLength()),
        configuration.isPasswordRequireUppercase(),
        configuration.isPasswordRequireLowercase(),
        configuration.isPasswordRequireDigit(),
        configuration.isPasswordRequireSymbol());
    return new LatchkeyConfig(usernamePolicy, passwordPolicy,
        configuration.getResetMaxFailures(),
        Duration.ofSeconds(configuration.getResetWindowSeconds()));
  }
}
