package com.codeheadsystems.latchkey.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.latchkey.server.store.RevocationStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies JWT session tokens.
 * <p>
 * Tokens are signed with HMAC-SHA256 under a process-wide secret supplied at construction.
 * They are self-contained and never persisted; only revocations are recorded, in an optional
 * {@link RevocationStore} keyed by the token's JTI.
 * <p>
 * Verification checks the signature before any claim is trusted, so a forged {@code exp} can
 * never make a token look unexpired.  {@link #rotateKey(byte[])} swaps the secret, which
 * invalidates every token issued under the previous one.
 */
public class JwtManager {

  private static final Logger log = LoggerFactory.getLogger(JwtManager.class);

  /**
   * Minimum HS256 secret length in bytes.
   */
  public static final int MIN_SECRET_BYTES = 32;

  private final String issuer;
  private final Duration ttl;
  private final RevocationStore revocationStore;
  private final Clock clock;

  private volatile Signer signer;

  /**
   * Creates a manager without server-side revocation.
   *
   * @param secret HMAC-SHA256 signing secret, at least 32 bytes
   * @param issuer JWT issuer claim
   * @param ttl    lifetime of every issued token
   */
  public JwtManager(byte[] secret, String issuer, Duration ttl) {
    this(secret, issuer, ttl, null, Clock.systemUTC());
  }

  /**
   * Creates a new JwtManager.
   *
   * @param secret          HMAC-SHA256 signing secret, at least 32 bytes
   * @param issuer          JWT issuer claim
   * @param ttl             lifetime of every issued token
   * @param revocationStore revocation set, or {@code null} to disable server-side revocation
   * @param clock           time source for issuing and verifying
   */
  public JwtManager(byte[] secret, String issuer, Duration ttl, RevocationStore revocationStore,
                    Clock clock) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    this.issuer = issuer;
    this.ttl = ttl;
    this.revocationStore = revocationStore;
    this.clock = clock;
    this.signer = newSigner(secret);
  }

  /**
   * Issues a token for a successfully authenticated user.
   *
   * @param username the subject
   * @return the signed token and its claims
   */
  public IssuedToken issueToken(String username) {
    String jti = UUID.randomUUID().toString();
    // JWT times have second precision
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(ttl);

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(username)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(signer.algorithm());

    log.debug("Issued JWT jti={} for {}", jti, username);
    return new IssuedToken(token, username, jti, now, expiresAt);
  }

  /**
   * Result of a successful verification.
   *
   * @param subject   the username
   * @param jti       the token identifier
   * @param expiresAt the token's expiry
   */
  public record VerifyResult(String subject, String jti, Instant expiresAt) {
  }

  /**
   * Verifies a token.
   *
   * @param token the JWT string
   * @return the verified claims
   * @throws TokenVerificationException if the token is malformed, wrongly signed, expired, or
   *                                    revoked
   */
  public VerifyResult verify(String token) {
    if (token == null || token.isBlank()) {
      throw new TokenVerificationException(TokenFailure.MALFORMED, null);
    }
    DecodedJWT decoded;
    try {
      decoded = signer.verifier().verify(token);
    } catch (JWTVerificationException e) {
      throw new TokenVerificationException(classify(e), e);
    }
    String jti = decoded.getId();
    String subject = decoded.getSubject();
    if (jti == null || subject == null || decoded.getExpiresAtAsInstant() == null) {
      throw new TokenVerificationException(TokenFailure.MALFORMED, null);
    }
    if (revocationStore != null && revocationStore.isRevoked(jti)) {
      throw new TokenVerificationException(TokenFailure.REVOKED, null);
    }
    return new VerifyResult(subject, jti, decoded.getExpiresAtAsInstant());
  }

  /**
   * Revokes a token so that it fails verification before its natural expiry.
   * <p>
   * A token that does not currently verify (expired, forged, already revoked) is left alone.
   *
   * @param token the JWT string
   * @return {@code true} if the token was active and is now revoked
   * @throws IllegalStateException if this manager was built without a revocation store
   */
  public boolean revoke(String token) {
    if (revocationStore == null) {
      throw new IllegalStateException("Revocation is not enabled");
    }
    VerifyResult result;
    try {
      result = verify(token);
    } catch (TokenVerificationException e) {
      log.debug("Not revoking inactive token: {}", e.failure());
      return false;
    }
    revocationStore.revoke(result.jti(), result.expiresAt());
    return true;
  }

  /**
   * Whether {@link #revoke(String)} is supported.
   *
   * @return {@code true} if a revocation store is configured
   */
  public boolean supportsRevocation() {
    return revocationStore != null;
  }

  /**
   * Replaces the signing secret.  Every token issued under the previous secret fails
   * verification from now on.  Intended for rare, coordinated key rotation.
   *
   * @param newSecret the new HMAC-SHA256 secret, at least 32 bytes
   */
  public void rotateKey(byte[] newSecret) {
    this.signer = newSigner(newSecret);
    log.info("Rotated JWT signing key; previously issued tokens are now invalid");
  }

  public Duration ttl() {
    return ttl;
  }

  private Signer newSigner(byte[] secret) {
    if (secret == null || secret.length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    Algorithm algorithm = Algorithm.HMAC256(secret);
    JWTVerifier verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(issuer))
        .build(clock);
    return new Signer(algorithm, verifier);
  }

  private static TokenFailure classify(JWTVerificationException e) {
    if (e instanceof SignatureVerificationException || e instanceof AlgorithmMismatchException) {
      return TokenFailure.INVALID_SIGNATURE;
    }
    if (e instanceof TokenExpiredException) {
      return TokenFailure.EXPIRED;
    }
    // decode errors and wrong or missing claims
    return TokenFailure.MALFORMED;
  }

  private record Signer(Algorithm algorithm, JWTVerifier verifier) {
  }
}
