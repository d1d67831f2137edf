package com.codeheadsystems.latchkey.server.resource;

import com.codeheadsystems.latchkey.model.LoginRequest;
import com.codeheadsystems.latchkey.model.LoginResponse;
import com.codeheadsystems.latchkey.model.LogoutResponse;
import com.codeheadsystems.latchkey.model.OkResponse;
import com.codeheadsystems.latchkey.model.ResetPasswordRequest;
import com.codeheadsystems.latchkey.model.SecurityQuestionRequest;
import com.codeheadsystems.latchkey.model.SecurityQuestionResponse;
import com.codeheadsystems.latchkey.model.SecurityQuestionsResponse;
import com.codeheadsystems.latchkey.model.SessionResponse;
import com.codeheadsystems.latchkey.model.SignupRequest;
import com.codeheadsystems.latchkey.model.TokenRequest;
import com.codeheadsystems.latchkey.server.auth.IssuedToken;
import com.codeheadsystems.latchkey.server.exception.AuthError;
import com.codeheadsystems.latchkey.server.exception.AuthException;
import com.codeheadsystems.latchkey.server.manager.LatchkeyAuthManager;
import com.codeheadsystems.latchkey.server.manager.LogoutResult;
import com.codeheadsystems.latchkey.server.model.SecurityQuestion;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource exposing {@link LatchkeyAuthManager}.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/signup}              : register an account</li>
 *   <li>{@code POST /auth/login}               : issue a session token</li>
 *   <li>{@code POST /auth/session/validate}    : resolve a token to its username</li>
 *   <li>{@code POST /auth/password/reset}      : reset the password with the security answer</li>
 *   <li>{@code POST /auth/logout}              : end a session</li>
 *   <li>{@code GET /auth/security-questions}   : list the questions offered at signup</li>
 *   <li>{@code POST /auth/security-question}   : the question to show for a username</li>
 * </ul>
 * Failures surface as {@link AuthException}; register {@link AuthExceptionMapper} alongside this
 * resource.
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final LatchkeyAuthManager manager;

  public AuthResource(LatchkeyAuthManager manager) {
    this.manager = manager;
  }

  @POST
  @Path("/signup")
  public OkResponse signup(SignupRequest req) {
    log.debug("signup()");
    require(req);
    SecurityQuestion question = SecurityQuestion.fromId(require(req.securityQuestion()))
        .orElseThrow(() -> new AuthException(AuthError.INVALID_REQUEST));
    manager.signup(require(req.username()), require(req.password()), question,
        require(req.securityAnswer()));
    return OkResponse.OK;
  }

  @POST
  @Path("/login")
  public LoginResponse login(LoginRequest req) {
    log.debug("login()");
    require(req);
    IssuedToken issued = manager.login(require(req.username()), require(req.password()));
    return new LoginResponse(issued.token(), issued.expiresAt().toString());
  }

  /**
   * A missing token is simply an invalid session.
   */
  @POST
  @Path("/session/validate")
  public SessionResponse validate(TokenRequest req) {
    log.debug("validate()");
    return new SessionResponse(manager.validateSession(req == null ? null : req.token()));
  }

  @POST
  @Path("/password/reset")
  public OkResponse resetPassword(ResetPasswordRequest req) {
    log.debug("resetPassword()");
    require(req);
    manager.resetPassword(require(req.username()), require(req.securityAnswer()),
        require(req.newPassword()));
    return OkResponse.OK;
  }

  @POST
  @Path("/logout")
  public LogoutResponse logout(TokenRequest req) {
    log.debug("logout()");
    LogoutResult result = manager.logout(req == null ? null : req.token());
    return new LogoutResponse(true, result.name(), result.message());
  }

  @GET
  @Path("/security-questions")
  public SecurityQuestionsResponse securityQuestions() {
    return new SecurityQuestionsResponse(manager.securityQuestions().stream()
        .map(AuthResource::toResponse)
        .toList());
  }

  @POST
  @Path("/security-question")
  public SecurityQuestionResponse securityQuestion(SecurityQuestionRequest req) {
    log.debug("securityQuestion()");
    return toResponse(manager.securityQuestion(req == null ? null : req.username()));
  }

  static SecurityQuestionResponse toResponse(SecurityQuestion question) {
    return new SecurityQuestionResponse(question.name(), question.prompt());
  }

  private static <T> T require(T value) {
    if (value == null) {
      throw new AuthException(AuthError.INVALID_REQUEST);
    }
    return value;
  }
}
