package com.codeheadsystems.latchkey.server.manager;

import com.codeheadsystems.latchkey.server.auth.IssuedToken;
import com.codeheadsystems.latchkey.server.auth.JwtManager;
import com.codeheadsystems.latchkey.server.auth.TokenVerificationException;
import com.codeheadsystems.latchkey.server.config.LatchkeyConfig;
import com.codeheadsystems.latchkey.server.config.PasswordPolicy;
import com.codeheadsystems.latchkey.server.config.UsernamePolicy;
import com.codeheadsystems.latchkey.server.exception.AuthError;
import com.codeheadsystems.latchkey.server.exception.AuthException;
import com.codeheadsystems.latchkey.server.hash.PasswordHasher;
import com.codeheadsystems.latchkey.server.hash.SecurityAnswers;
import com.codeheadsystems.latchkey.server.model.Account;
import com.codeheadsystems.latchkey.server.model.HashedSecret;
import com.codeheadsystems.latchkey.server.model.SecurityQuestion;
import com.codeheadsystems.latchkey.server.store.CredentialStore;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service implementing signup, login, session validation, logout and
 * security-question password reset.
 * <p>
 * Framework adapters ({@code AuthResource} for JAX-RS / Dropwizard, {@code AuthController} for
 * Spring Boot) stay thin: they unwrap requests and translate exceptions into HTTP responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link AuthException} with {@link AuthError#INVALID_USERNAME},
 *       {@link AuthError#WEAK_PASSWORD} or {@link AuthError#INVALID_REQUEST} → HTTP 400</li>
 *   <li>{@link AuthException} with {@link AuthError#DUPLICATE_USERNAME} → HTTP 409</li>
 *   <li>{@link AuthException} with {@link AuthError#INVALID_CREDENTIALS} or
 *       {@link AuthError#UNAUTHORIZED} → HTTP 401</li>
 *   <li>{@link com.codeheadsystems.latchkey.server.exception.CredentialStoreException} → HTTP 500</li>
 * </ul>
 * Unknown usernames cost the same password-hash work as known ones and fail with the same
 * error, so responses do not reveal which accounts exist.
 */
public class LatchkeyAuthManager {

  private static final Logger log = LoggerFactory.getLogger(LatchkeyAuthManager.class);
  private static final String DECOY_MAC = "HmacSHA256";

  private final CredentialStore credentialStore;
  private final PasswordHasher passwordHasher;
  private final JwtManager jwtManager;
  private final UsernamePolicy usernamePolicy;
  private final PasswordPolicy passwordPolicy;
  private final ResetAttemptLimiter resetLimiter;
  private final Clock clock;

  /**
   * Verified against when the username is unknown, so the work matches a real check.
   */
  private final HashedSecret dummySecret;
  private final byte[] decoyKey;

  /**
   * Instantiates a new manager with the system UTC clock.
   *
   * @param credentialStore the account store
   * @param passwordHasher  hasher for passwords and security answers
   * @param jwtManager      the token service
   * @param config          policies and reset throttling
   */
  public LatchkeyAuthManager(CredentialStore credentialStore, PasswordHasher passwordHasher,
                             JwtManager jwtManager, LatchkeyConfig config) {
    this(credentialStore, passwordHasher, jwtManager, config, Clock.systemUTC());
  }

  /**
   * Instantiates a new manager.
   *
   * @param credentialStore the account store
   * @param passwordHasher  hasher for passwords and security answers
   * @param jwtManager      the token service
   * @param config          policies and reset throttling
   * @param clock           time source for account creation and throttling windows
   */
  public LatchkeyAuthManager(CredentialStore credentialStore, PasswordHasher passwordHasher,
                             JwtManager jwtManager, LatchkeyConfig config, Clock clock) {
    this.credentialStore = credentialStore;
    this.passwordHasher = passwordHasher;
    this.jwtManager = jwtManager;
    this.usernamePolicy = config.usernamePolicy();
    this.passwordPolicy = config.passwordPolicy();
    this.resetLimiter = new ResetAttemptLimiter(
        config.resetMaxFailures(), config.resetWindow(), clock);
    this.clock = clock;

    SecureRandom random = new SecureRandom();
    byte[] filler = new byte[16];
    random.nextBytes(filler);
    this.dummySecret = passwordHasher.hash(HexFormat.of().formatHex(filler));
    this.decoyKey = new byte[32];
    random.nextBytes(decoyKey);
  }

  // ── Accounts ──────────────────────────────────────────────────────────────

  /**
   * Registers a new account.
   *
   * @param username         the requested username
   * @param password         the plaintext password
   * @param securityQuestion the chosen recovery question
   * @param securityAnswer   the plaintext answer, normalized before hashing
   * @return the stored account
   * @throws AuthException INVALID_USERNAME, WEAK_PASSWORD, INVALID_REQUEST or DUPLICATE_USERNAME
   */
  public Account signup(String username, String password, SecurityQuestion securityQuestion,
                        String securityAnswer) {
    log.debug("signup({})", username);
    if (!usernamePolicy.isSatisfiedBy(username)) {
      throw new AuthException(AuthError.INVALID_USERNAME);
    }
    List<String> violations = passwordPolicy.violations(password);
    if (!violations.isEmpty()) {
      log.debug("signup({}) rejected password: {}", username, violations);
      throw new AuthException(AuthError.WEAK_PASSWORD);
    }
    String normalizedAnswer = SecurityAnswers.normalize(securityAnswer);
    if (securityQuestion == null || normalizedAnswer.isEmpty()
        || normalizedAnswer.length() > passwordPolicy.maxLength()) {
      throw new AuthException(AuthError.INVALID_REQUEST);
    }
    // Skip the hashing for a name that is obviously taken; create() still settles races.
    if (credentialStore.findByUsername(username).isPresent()) {
      throw new AuthException(AuthError.DUPLICATE_USERNAME);
    }
    Account account = new Account(
        username,
        passwordHasher.hash(password),
        securityQuestion,
        passwordHasher.hash(normalizedAnswer),
        clock.instant());
    Account created = credentialStore.create(account);
    log.info("Created account {}", created.username());
    return created;
  }

  /**
   * Checks a username and password and issues a session token.
   *
   * @param username the username, any case
   * @param password the plaintext password
   * @return the issued token
   * @throws AuthException INVALID_CREDENTIALS for an unknown user or a wrong password alike
   */
  public IssuedToken login(String username, String password) {
    log.debug("login({})", username);
    Optional<Account> account = credentialStore.findByUsername(username);
    boolean verified = verifyBounded(password,
        account.map(Account::password).orElse(dummySecret));
    if (account.isEmpty() || !verified) {
      log.debug("login({}) failed", username);
      throw new AuthException(AuthError.INVALID_CREDENTIALS);
    }
    return jwtManager.issueToken(account.get().username());
  }

  // ── Sessions ──────────────────────────────────────────────────────────────

  /**
   * Resolves a session token to its username.
   *
   * @param token the JWT string
   * @return the username the token was issued to
   * @throws AuthException UNAUTHORIZED for any malformed, forged, expired or revoked token
   */
  public String validateSession(String token) {
    try {
      return jwtManager.verify(token).subject();
    } catch (TokenVerificationException e) {
      log.debug("validateSession() rejected: {}", e.failure());
      throw new AuthException(AuthError.UNAUTHORIZED);
    }
  }

  /**
   * Ends a session.  Never fails; the result says what actually happened to the token.
   *
   * @param token the JWT string
   * @return REVOKED, NOT_ACTIVE, or CLIENT_DISCARD when revocation is disabled
   */
  public LogoutResult logout(String token) {
    if (!jwtManager.supportsRevocation()) {
      return LogoutResult.CLIENT_DISCARD;
    }
    return jwtManager.revoke(token) ? LogoutResult.REVOKED : LogoutResult.NOT_ACTIVE;
  }

  // ── Recovery ──────────────────────────────────────────────────────────────

  /**
   * Replaces the password of an account whose security answer matches.
   *
   * @param username       the username, any case
   * @param securityAnswer the plaintext answer, normalized before checking
   * @param newPassword    the new plaintext password
   * @throws AuthException INVALID_CREDENTIALS for an unknown user, a wrong answer or while
   *                       throttled; WEAK_PASSWORD if the answer was right but the new password
   *                       fails the policy.  A correct answer clears the throttle window even
   *                       when the new password is then rejected
   */
  public void resetPassword(String username, String securityAnswer, String newPassword) {
    log.debug("resetPassword({})", username);
    if (!resetLimiter.tryAcquire(username)) {
      log.warn("Password reset for {} throttled", username);
      throw new AuthException(AuthError.INVALID_CREDENTIALS);
    }
    Optional<Account> account = credentialStore.findByUsername(username);
    boolean verified = verifyBounded(SecurityAnswers.normalize(securityAnswer),
        account.map(Account::securityAnswer).orElse(dummySecret));
    if (account.isEmpty() || !verified) {
      log.debug("resetPassword({}) failed", username);
      throw new AuthException(AuthError.INVALID_CREDENTIALS);
    }
    resetLimiter.reset(username);
    List<String> violations = passwordPolicy.violations(newPassword);
    if (!violations.isEmpty()) {
      log.debug("resetPassword({}) rejected password: {}", username, violations);
      throw new AuthException(AuthError.WEAK_PASSWORD);
    }
    HashedSecret replacement = passwordHasher.hash(newPassword);
    if (!credentialStore.updatePassword(account.get().username(), replacement)) {
      throw new AuthException(AuthError.INVALID_CREDENTIALS);
    }
    log.info("Password reset for {}", account.get().username());
  }

  /**
   * Returns the recovery question to show for a username.
   * <p>
   * Unknown usernames get a decoy that is stable for the lifetime of this manager, so
   * repeated lookups agree and do not reveal that the account is missing.
   *
   * @param username the username, any case
   * @return the account's question, or a decoy
   */
  public SecurityQuestion securityQuestion(String username) {
    return credentialStore.findByUsername(username)
        .map(Account::securityQuestion)
        .orElseGet(() -> decoyQuestion(username));
  }

  /**
   * The questions users may choose from at signup.
   *
   * @return every question, in declaration order
   */
  public List<SecurityQuestion> securityQuestions() {
    return List.of(SecurityQuestion.values());
  }

  /**
   * Verifies a secret, refusing input longer than the password policy allows.  Oversized input
   * still pays for one verification so it is not answered faster.
   */
  private boolean verifyBounded(String secret, HashedSecret expected) {
    if (secret != null && secret.length() > passwordPolicy.maxLength()) {
      passwordHasher.verify("", dummySecret);
      return false;
    }
    return passwordHasher.verify(secret, expected);
  }

  private SecurityQuestion decoyQuestion(String username) {
    String key = username == null ? "" : Account.keyOf(username);
    try {
      Mac mac = Mac.getInstance(DECOY_MAC);
      mac.init(new SecretKeySpec(decoyKey, DECOY_MAC));
      byte[] digest = mac.doFinal(key.getBytes(StandardCharsets.UTF_8));
      SecurityQuestion[] questions = SecurityQuestion.values();
      return questions[Byte.toUnsignedInt(digest[0]) % questions.length];
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HmacSHA256 unavailable", e);
    }
  }
}
