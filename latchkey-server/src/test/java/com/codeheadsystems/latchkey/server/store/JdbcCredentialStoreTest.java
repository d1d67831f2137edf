package com.codeheadsystems.latchkey.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.latchkey.server.exception.AuthError;
import com.codeheadsystems.latchkey.server.exception.AuthException;
import com.codeheadsystems.latchkey.server.exception.CredentialStoreException;
import com.codeheadsystems.latchkey.server.model.Account;
import com.codeheadsystems.latchkey.server.model.HashedSecret;
import com.codeheadsystems.latchkey.server.model.SecurityQuestion;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.TimeZone;
import java.util.UUID;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcCredentialStoreTest {

  private static final Instant CREATED = Instant.parse("2026-01-01T00:00:00Z");

  private JdbcDataSource dataSource;
  private JdbcCredentialStore store;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    store = new JdbcCredentialStore(dataSource);
    store.initializeSchema();
  }

  private static Account account(String username) {
    return account(username, CREATED);
  }

  private static Account account(String username, Instant createdAt) {
    return new Account(username, InMemoryCredentialStoreTest.secret(1), SecurityQuestion.FIRST_CAR,
        InMemoryCredentialStoreTest.secret(2), createdAt);
  }

  @Test
  void create_thenFind_roundTripsEveryField() {
    Account original = account("Alice");
    store.create(original);

    Account loaded = store.findByUsername("alice").orElseThrow();

    assertThat(loaded).isEqualTo(original);
  }

  @Test
  void createdAt_survivesAmbiguousLocalHour() {
    TimeZone previous = TimeZone.getDefault();
    TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
    try {
      // both instants are 01:30 local time on the night clocks fall back
      Instant firstPass = Instant.parse("2025-11-02T05:30:00Z");
      Instant secondPass = Instant.parse("2025-11-02T06:30:00Z");
      store.create(account("early", firstPass));
      store.create(account("late", secondPass));

      assertThat(store.findByUsername("early").orElseThrow().createdAt()).isEqualTo(firstPass);
      assertThat(store.findByUsername("late").orElseThrow().createdAt()).isEqualTo(secondPass);
    } finally {
      TimeZone.setDefault(previous);
    }
  }

  @Test
  void initializeSchema_isIdempotent() {
    store.create(account("alice"));

    store.initializeSchema();

    assertThat(store.findByUsername("alice")).isPresent();
  }

  @Test
  void create_duplicate_isRejected() {
    store.create(account("alice"));

    assertThatThrownBy(() -> store.create(account("Alice")))
        .isInstanceOf(AuthException.class)
        .extracting(e -> ((AuthException) e).error())
        .isEqualTo(AuthError.DUPLICATE_USERNAME);
  }

  @Test
  void findByUsername_unknownOrNull_isEmpty() {
    assertThat(store.findByUsername("nobody")).isEmpty();
    assertThat(store.findByUsername(null)).isEmpty();
  }

  @Test
  void updatePassword_replacesHash() {
    store.create(account("alice"));
    HashedSecret replacement = InMemoryCredentialStoreTest.secret(9);

    assertThat(store.updatePassword("ALICE", replacement)).isTrue();

    Account loaded = store.findByUsername("alice").orElseThrow();
    assertThat(loaded.password()).isEqualTo(replacement);
    assertThat(loaded.securityAnswer()).isEqualTo(InMemoryCredentialStoreTest.secret(2));
  }

  @Test
  void updatePassword_unknownUser_returnsFalse() {
    assertThat(store.updatePassword("nobody", InMemoryCredentialStoreTest.secret(9))).isFalse();
  }

  @Test
  void sqlFailure_surfacesAsCredentialStoreException() throws Exception {
    try (Connection connection = dataSource.getConnection();
         Statement statement = connection.createStatement()) {
      statement.execute("DROP TABLE " + JdbcCredentialStore.TABLE);
    }

    assertThatThrownBy(() -> store.findByUsername("alice"))
        .isInstanceOf(CredentialStoreException.class);
  }
}
