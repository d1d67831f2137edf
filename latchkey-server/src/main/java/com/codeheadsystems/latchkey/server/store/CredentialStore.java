package com.codeheadsystems.latchkey.server.store;

import com.codeheadsystems.latchkey.server.exception.AuthException;
import com.codeheadsystems.latchkey.server.model.Account;
import com.codeheadsystems.latchkey.server.model.HashedSecret;
import java.util.Optional;

/**
 * Storage abstraction for account records.
 * <p>
 * Implementations must be thread-safe.  Usernames are unique case-insensitively
 * ({@link Account#keyOf(String)}) and stored case-preserving.
 * <p>
 * <strong>Atomicity contract:</strong> {@link #create(Account)} must check uniqueness and insert
 * as a single atomic step, so that two concurrent creates of the same username yield exactly one
 * success and one {@code DUPLICATE_USERNAME} failure.  {@link #updatePassword} must be
 * serialized per username.  Neither may apply a partial change.  Atomicity is per key; unrelated
 * usernames must not contend on a global lock.
 */
public interface CredentialStore {

  /**
   * Inserts a new account.
   *
   * @param account the fully built account
   * @return the stored account
   * @throws AuthException with {@code DUPLICATE_USERNAME} if the username is taken, or
   *                       {@code INVALID_USERNAME} if it is blank
   */
  Account create(Account account);

  /**
   * Looks up an account by username, ignoring case.
   *
   * @param username the username
   * @return the account, or empty if no account has that username
   */
  Optional<Account> findByUsername(String username);

  /**
   * Replaces the password hash of an existing account.
   *
   * @param username    the username, matched case-insensitively
   * @param newPassword the new password hash
   * @return {@code true} if an account was updated, {@code false} if none exists
   */
  boolean updatePassword(String username, HashedSecret newPassword);
}
