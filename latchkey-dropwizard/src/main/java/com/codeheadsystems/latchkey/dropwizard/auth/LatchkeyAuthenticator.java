package com.codeheadsystems.latchkey.dropwizard.auth;

import com.codeheadsystems.latchkey.server.auth.JwtManager;
import com.codeheadsystems.latchkey.server.auth.TokenVerificationException;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that validates bearer session tokens using {@link JwtManager}.
 */
public class LatchkeyAuthenticator implements Authenticator<String, LatchkeyPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(LatchkeyAuthenticator.class);

  private final JwtManager jwtManager;

  /**
   * Instantiates a new Latchkey authenticator.
   *
   * @param jwtManager the jwt manager
   */
  public LatchkeyAuthenticator(JwtManager jwtManager) {
    this.jwtManager = jwtManager;
  }

  @Override
  public Optional<LatchkeyPrincipal> authenticate(String token) throws AuthenticationException {
    try {
      JwtManager.VerifyResult result = jwtManager.verify(token);
      return Optional.of(new LatchkeyPrincipal(result.subject(), result.jti()));
    } catch (TokenVerificationException e) {
      log.debug("Bearer token rejected: {}", e.failure());
      return Optional.empty();
    }
  }
}
