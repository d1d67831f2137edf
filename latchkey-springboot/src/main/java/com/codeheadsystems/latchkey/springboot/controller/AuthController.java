package com.codeheadsystems.latchkey.springboot.controller;

import com.codeheadsystems.latchkey.model.ErrorResponse;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

  private static final Logger log = LoggerFactory.getLogger(AuthController.class);

  private final LatchkeyAuthManager manager;

  public AuthController(LatchkeyAuthManager manager) {
    this.manager = manager;
  }

  @PostMapping("/signup")
  public OkResponse signup(@RequestBody(required = false) SignupRequest req) {
    log.debug("signup()");
    require(req);
    SecurityQuestion question = SecurityQuestion.fromId(require(req.securityQuestion()))
        .orElseThrow(() -> new AuthException(AuthError.INVALID_REQUEST));
    manager.signup(require(req.username()), require(req.password()), question,
        require(req.securityAnswer()));
    return OkResponse.OK;
  }

  @PostMapping("/login")
  public LoginResponse login(@RequestBody(required = false) LoginRequest req) {
    log.debug("login()");
    require(req);
    IssuedToken issued = manager.login(require(req.username()), require(req.password()));
    return new LoginResponse(issued.token(), issued.expiresAt().toString());
  }

  @PostMapping("/session/validate")
  public SessionResponse validate(@RequestBody(required = false) TokenRequest req) {
    log.debug("validate()");
    return new SessionResponse(manager.validateSession(req == null ? null : req.token()));
  }

  @PostMapping("/password/reset")
  public OkResponse resetPassword(@RequestBody(required = false) ResetPasswordRequest req) {
    log.debug("resetPassword()");
    require(req);
    manager.resetPassword(require(req.username()), require(req.securityAnswer()),
        require(req.newPassword()));
    return OkResponse.OK;
  }

  @PostMapping("/logout")
  public LogoutResponse logout(@RequestBody(required = false) TokenRequest req) {
    log.debug("logout()");
    LogoutResult result = manager.logout(req == null ? null : req.token());
    return new LogoutResponse(true, result.name(), result.message());
  }

  @GetMapping("/security-questions")
  public SecurityQuestionsResponse securityQuestions() {
    return new SecurityQuestionsResponse(manager.securityQuestions().stream()
        .map(AuthController::toResponse)
        .toList());
  }

  @PostMapping("/security-question")
  public SecurityQuestionResponse securityQuestion(
      @RequestBody(required = false) SecurityQuestionRequest req) {
    log.debug("securityQuestion()");
    return toResponse(manager.securityQuestion(req == null ? null : req.username()));
  }

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<ErrorResponse> handleAuthException(AuthException e) {
    AuthError error = e.error();
    return ResponseEntity.status(error.httpStatus())
        .body(new ErrorResponse(error.wireName(), error.message()));
  }

  private static SecurityQuestionResponse toResponse(SecurityQuestion question) {
    return new SecurityQuestionResponse(question.name(), question.prompt());
  }

  private static <T> T require(T value) {
    if (value == null) {
      throw new AuthException(AuthError.INVALID_REQUEST);
    }
    return value;
  }
}
