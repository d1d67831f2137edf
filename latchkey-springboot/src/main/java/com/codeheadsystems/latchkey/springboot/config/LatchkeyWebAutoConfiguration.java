package com.codeheadsystems.latchkey.springboot.config;

import com.codeheadsystems.latchkey.server.auth.JwtManager;
import com.codeheadsystems.latchkey.server.store.CredentialStore;
import com.codeheadsystems.latchkey.springboot.controller.AuthController;
import com.codeheadsystems.latchkey.springboot.health.LatchkeyHealthIndicator;
import com.codeheadsystems.latchkey.springboot.security.LatchkeySecurityConfig;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Exposes the {@code /auth} endpoints, the bearer-token security filter chain and the health
 * indicator in servlet web applications.
 */
@AutoConfiguration(after = LatchkeyAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@Import({AuthController.class, LatchkeySecurityConfig.class})
public class LatchkeyWebAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public LatchkeyHealthIndicator latchkeyHealthIndicator(JwtManager jwtManager,
                                                         CredentialStore credentialStore) {
    return new LatchkeyHealthIndicator(jwtManager, credentialStore);
  }
}
