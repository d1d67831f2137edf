package com.codeheadsystems.latchkey.springboot.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Minimal application that picks up Latchkey through auto-configuration.
 */
@SpringBootApplication
public class LatchkeyTestApplication {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(LatchkeyTestApplication.class, args);
  }
}
