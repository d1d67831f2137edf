package com.codeheadsystems.latchkey.springboot.security;

import com.codeheadsystems.latchkey.server.auth.JwtManager;
import com.codeheadsystems.latchkey.server.auth.TokenVerificationException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <token>}.  Requests without a
 * valid token pass through unauthenticated and are rejected by the security chain where
 * authentication is required.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
  private static final String BEARER = "Bearer ";

  private final JwtManager jwtManager;

  /**
   * Instantiates a new Jwt authentication filter.
   *
   * @param jwtManager the jwt manager
   */
  public JwtAuthenticationFilter(JwtManager jwtManager) {
    this.jwtManager = jwtManager;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String authHeader = request.getHeader("Authorization");
    if (authHeader != null && authHeader.startsWith(BEARER)) {
      String token = authHeader.substring(BEARER.length());
      try {
        JwtManager.VerifyResult result = jwtManager.verify(token);
        LatchkeyPrincipal principal = new LatchkeyPrincipal(result.subject(), result.jti());
        UsernamePasswordAuthenticationToken auth =
            new UsernamePasswordAuthenticationToken(principal, null, List.of());
        SecurityContextHolder.getContext().setAuthentication(auth);
      } catch (TokenVerificationException e) {
        log.debug("Bearer token rejected: {}", e.failure());
      }
    }
    filterChain.doFilter(request, response);
  }
}
