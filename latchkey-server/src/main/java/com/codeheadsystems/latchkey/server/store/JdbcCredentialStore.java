package com.codeheadsystems.latchkey.server.store;

import com.codeheadsystems.latchkey.server.exception.AuthError;
import com.codeheadsystems.latchkey.server.exception.AuthException;
import com.codeheadsystems.latchkey.server.exception.CredentialStoreException;
import com.codeheadsystems.latchkey.server.model.Account;
import com.codeheadsystems.latchkey.server.model.HashedSecret;
import com.codeheadsystems.latchkey.server.model.SecurityQuestion;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialStore} backed by a single relational table.
 * <p>
 * Uniqueness is enforced by the primary key on {@code username_key} (the lower-cased username),
 * so the insert itself is the atomic check-and-create: a concurrent duplicate fails with an
 * integrity violation rather than racing a separate {@code SELECT}.  Password updates are a
 * single {@code UPDATE} statement, serialized per row by the database.
 * <p>
 * Call {@link #initializeSchema()} once at startup if the table is not managed by migrations.
 */
public class JdbcCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcCredentialStore.class);

  static final String TABLE = "latchkey_account";

  private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
      + "username_key VARCHAR(64) NOT NULL PRIMARY KEY, "
      + "username VARCHAR(64) NOT NULL, "
      + "password_salt VARCHAR(128) NOT NULL, "
      + "password_hash VARCHAR(256) NOT NULL, "
      + "security_question VARCHAR(32) NOT NULL, "
      + "answer_salt VARCHAR(128) NOT NULL, "
      + "answer_hash VARCHAR(256) NOT NULL, "
      + "created_at TIMESTAMP WITH TIME ZONE NOT NULL)";

  private static final String INSERT = "INSERT INTO " + TABLE
      + " (username_key, username, password_salt, password_hash, security_question,"
      + " answer_salt, answer_hash, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

  private static final String SELECT = "SELECT username, password_salt, password_hash,"
      + " security_question, answer_salt, answer_hash, created_at FROM " + TABLE
      + " WHERE username_key = ?";

  private static final String UPDATE_PASSWORD = "UPDATE " + TABLE
      + " SET password_salt = ?, password_hash = ? WHERE username_key = ?";

  // SQLSTATE class 23 is "integrity constraint violation" across vendors.
  private static final String INTEGRITY_VIOLATION_CLASS = "23";

  private final DataSource dataSource;

  /**
   * Instantiates a new JDBC credential store.
   *
   * @param dataSource the data source holding the account table
   */
  public JdbcCredentialStore(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  /**
   * Creates the account table if it does not already exist.
   */
  public void initializeSchema() {
    try (Connection connection = dataSource.getConnection();
         Statement statement = connection.createStatement()) {
      statement.execute(CREATE_TABLE);
      log.info("Ensured table {} exists", TABLE);
    } catch (SQLException e) {
      throw new CredentialStoreException("Failed to create table " + TABLE, e);
    }
  }

  @Override
  public Account create(Account account) {
    if (account.username().isBlank()) {
      throw new AuthException(AuthError.INVALID_USERNAME);
    }
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(INSERT)) {
      statement.setString(1, account.key());
      statement.setString(2, account.username());
      statement.setString(3, account.password().saltBase64());
      statement.setString(4, account.password().digestBase64());
      statement.setString(5, account.securityQuestion().name());
      statement.setString(6, account.securityAnswer().saltBase64());
      statement.setString(7, account.securityAnswer().digestBase64());
      statement.setObject(8, account.createdAt().atOffset(ZoneOffset.UTC));
      statement.executeUpdate();
      log.debug("Stored account {}", account.username());
      return account;
    } catch (SQLException e) {
      if (isIntegrityViolation(e)) {
        log.debug("Rejected create for taken username {}", account.username());
        throw new AuthException(AuthError.DUPLICATE_USERNAME);
      }
      throw new CredentialStoreException("Failed to insert account", e);
    }
  }

  @Override
  public Optional<Account> findByUsername(String username) {
    if (username == null) {
      return Optional.empty();
    }
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(SELECT)) {
      statement.setString(1, Account.keyOf(username));
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new Account(
            rs.getString("username"),
            HashedSecret.fromBase64(rs.getString("password_salt"), rs.getString("password_hash")),
            SecurityQuestion.valueOf(rs.getString("security_question")),
            HashedSecret.fromBase64(rs.getString("answer_salt"), rs.getString("answer_hash")),
            rs.getObject("created_at", OffsetDateTime.class).toInstant()));
      }
    } catch (SQLException e) {
      throw new CredentialStoreException("Failed to load account", e);
    }
  }

  @Override
  public boolean updatePassword(String username, HashedSecret newPassword) {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(UPDATE_PASSWORD)) {
      statement.setString(1, newPassword.saltBase64());
      statement.setString(2, newPassword.digestBase64());
      statement.setString(3, Account.keyOf(username));
      return statement.executeUpdate() == 1;
    } catch (SQLException e) {
      throw new CredentialStoreException("Failed to update password", e);
    }
  }

  private static boolean isIntegrityViolation(SQLException e) {
    if (e instanceof SQLIntegrityConstraintViolationException) {
      return true;
    }
    String state = e.getSQLState();
    return state != null && state.startsWith(INTEGRITY_VIOLATION_CLASS);
  }
}
