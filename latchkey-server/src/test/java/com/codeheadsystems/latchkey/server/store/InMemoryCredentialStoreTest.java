package com.codeheadsystems.latchkey.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.latchkey.server.exception.AuthError;
import com.codeheadsystems.latchkey.server.exception.AuthException;
import com.codeheadsystems.latchkey.server.model.Account;
import com.codeheadsystems.latchkey.server.model.HashedSecret;
import com.codeheadsystems.latchkey.server.model.SecurityQuestion;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryCredentialStoreTest {

  private static final HashedSecret PASSWORD = secret(1);
  private static final HashedSecret ANSWER = secret(2);

  private InMemoryCredentialStore store;

  static HashedSecret secret(int fill) {
    byte[] salt = new byte[16];
    byte[] digest = new byte[32];
    Arrays.fill(salt, (byte) fill);
    Arrays.fill(digest, (byte) (fill + 100));
    return new HashedSecret(salt, digest);
  }

  static Account account(String username) {
    return new Account(username, PASSWORD, SecurityQuestion.PET_NAME, ANSWER,
        Instant.parse("2026-01-01T00:00:00Z"));
  }

  @BeforeEach
  void setUp() {
    store = new InMemoryCredentialStore();
  }

  @Test
  void create_thenFind_isCaseInsensitive() {
    store.create(account("Alice"));

    assertThat(store.findByUsername("alice")).hasValueSatisfying(a -> {
      assertThat(a.username()).as("case is preserved").isEqualTo("Alice");
      assertThat(a.password()).isEqualTo(PASSWORD);
    });
    assertThat(store.findByUsername("ALICE")).isPresent();
  }

  @Test
  void findByUsername_unknownOrNull_isEmpty() {
    assertThat(store.findByUsername("nobody")).isEmpty();
    assertThat(store.findByUsername(null)).isEmpty();
  }

  @Test
  void create_duplicateDifferingOnlyInCase_isRejected() {
    store.create(account("alice"));

    assertThatThrownBy(() -> store.create(account("ALICE")))
        .isInstanceOf(AuthException.class)
        .extracting(e -> ((AuthException) e).error())
        .isEqualTo(AuthError.DUPLICATE_USERNAME);
    assertThat(store.findByUsername("alice").get().username()).isEqualTo("alice");
  }

  @Test
  void create_blankUsername_isRejected() {
    assertThatThrownBy(() -> store.create(account("  ")))
        .isInstanceOf(AuthException.class)
        .extracting(e -> ((AuthException) e).error())
        .isEqualTo(AuthError.INVALID_USERNAME);
  }

  @Test
  void updatePassword_replacesOnlyThePassword() {
    Account original = store.create(account("alice"));
    HashedSecret replacement = secret(7);

    assertThat(store.updatePassword("ALICE", replacement)).isTrue();

    Account updated = store.findByUsername("alice").orElseThrow();
    assertThat(updated.password()).isEqualTo(replacement);
    assertThat(updated.securityAnswer()).isEqualTo(original.securityAnswer());
    assertThat(updated.securityQuestion()).isEqualTo(original.securityQuestion());
    assertThat(updated.createdAt()).isEqualTo(original.createdAt());
  }

  @Test
  void updatePassword_unknownUser_returnsFalse() {
    assertThat(store.updatePassword("nobody", secret(7))).isFalse();
    assertThat(store.findByUsername("nobody")).isEmpty();
  }

  @Test
  void create_concurrentSameUsername_exactlyOneWins() throws Exception {
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        String username = i % 2 == 0 ? "bob" : "BOB";
        results.add(pool.submit(() -> {
          start.await();
          try {
            store.create(account(username));
            return true;
          } catch (AuthException e) {
            return false;
          }
        }));
      }
      start.countDown();
      int successes = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          successes++;
        }
      }
      assertThat(successes).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }
}
