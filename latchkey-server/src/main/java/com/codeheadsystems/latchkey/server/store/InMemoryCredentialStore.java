package com.codeheadsystems.latchkey.server.store;

import com.codeheadsystems.latchkey.server.exception.AuthError;
import com.codeheadsystems.latchkey.server.exception.AuthException;
import com.codeheadsystems.latchkey.server.model.Account;
import com.codeheadsystems.latchkey.server.model.HashedSecret;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All accounts are lost on server restart. Suitable for development and integration testing
 * only. Use {@link JdbcCredentialStore} or another persistent implementation for production.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final ConcurrentHashMap<String, Account> store = new ConcurrentHashMap<>();

  public InMemoryCredentialStore() {
    log.warn("Using InMemoryCredentialStore. Accounts will NOT survive restarts. "
        + "Replace with a persistent CredentialStore for production.");
  }

  @Override
  public Account create(Account account) {
    if (account.username().isBlank()) {
      throw new AuthException(AuthError.INVALID_USERNAME);
    }
    Account existing = store.putIfAbsent(account.key(), account);
    if (existing != null) {
      log.debug("Rejected create for taken username {}", account.username());
      throw new AuthException(AuthError.DUPLICATE_USERNAME);
    }
    log.debug("Stored account {}", account.username());
    return account;
  }

  @Override
  public Optional<Account> findByUsername(String username) {
    if (username == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(store.get(Account.keyOf(username)));
  }

  @Override
  public boolean updatePassword(String username, HashedSecret newPassword) {
    Account updated = store.computeIfPresent(Account.keyOf(username),
        (key, account) -> account.withPassword(newPassword));
    return updated != null;
  }
}
