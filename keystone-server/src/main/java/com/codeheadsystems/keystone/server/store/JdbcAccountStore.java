package com.codeheadsystems.keystone.server.store;

import com.codeheadsystems.keystone.server.model.Account;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AccountStore} over plain JDBC.
 * <p>
 * Email uniqueness is enforced by a {@code UNIQUE} constraint on {@code accounts.email}; a
 * unique violation on insert (SQLState {@code 23505}) is reported as
 * {@link DuplicateEmailException}, so concurrent registrations of the same email resolve to
 * exactly one account. Connection pooling is left to the supplied {@link DataSource}.
 */
public class JdbcAccountStore implements AccountStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcAccountStore.class);

  private static final String SCHEMA = """
      CREATE TABLE IF NOT EXISTS accounts (
        id VARCHAR(36) PRIMARY KEY,
        email VARCHAR(255) NOT NULL,
        password_digest VARCHAR(255) NOT NULL,
        name VARCHAR(255),
        created_at TIMESTAMP WITH TIME ZONE NOT NULL,
        CONSTRAINT uq_accounts_email UNIQUE (email)
      )
      """;

  private static final String SELECT_BY_EMAIL =
      "SELECT id, email, password_digest, name, created_at FROM accounts WHERE email = ?";

  private static final String INSERT =
      "INSERT INTO accounts (id, email, password_digest, name, created_at) VALUES (?, ?, ?, ?, ?)";

  private static final String UNIQUE_VIOLATION = "23505";

  private final DataSource dataSource;
  private final Clock clock;

  /**
   * Instantiates a new Jdbc account store.
   *
   * @param dataSource the data source
   */
  public JdbcAccountStore(DataSource dataSource) {
    this(dataSource, Clock.systemUTC());
  }

  /**
   * Instantiates a new Jdbc account store.
   *
   * @param dataSource the data source
   * @param clock      source of creation timestamps
   */
  public JdbcAccountStore(DataSource dataSource, Clock clock) {
    this.dataSource = dataSource;
    this.clock = clock;
  }

  /**
   * Creates the {@code accounts} table and its unique constraint if they do not exist yet.
   */
  public void createSchema() {
    try (Connection c = dataSource.getConnection(); Statement st = c.createStatement()) {
      st.executeUpdate(SCHEMA);
    } catch (SQLException e) {
      throw new AccountStoreException("Failed to create accounts schema", e);
    }
    log.info("Accounts schema ready");
  }

  @Override
  public Optional<Account> findByEmail(String email) {
    try (Connection c = dataSource.getConnection();
         PreparedStatement ps = c.prepareStatement(SELECT_BY_EMAIL)) {
      ps.setString(1, email);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        return Optional.of(new Account(
            rs.getString("id"),
            rs.getString("email"),
            rs.getString("password_digest"),
            rs.getString("name"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant()));
      }
    } catch (SQLException e) {
      throw new AccountStoreException("Failed to look up account", e);
    }
  }

  @Override
  public Account create(String email, String passwordDigest, String name) {
    Instant createdAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    Account account = new Account(UUID.randomUUID().toString(), email, passwordDigest, name,
        createdAt);
    try (Connection c = dataSource.getConnection();
         PreparedStatement ps = c.prepareStatement(INSERT)) {
      ps.setString(1, account.id());
      ps.setString(2, account.email());
      ps.setString(3, account.passwordDigest());
      ps.setString(4, account.name());
      ps.setObject(5, OffsetDateTime.ofInstant(createdAt, ZoneOffset.UTC));
      ps.executeUpdate();
    } catch (SQLException e) {
      if (isUniqueViolation(e)) {
        throw new DuplicateEmailException(email, e);
      }
      throw new AccountStoreException("Failed to create account", e);
    }
    log.debug("Stored account {}", account.id());
    return account;
  }

  private static boolean isUniqueViolation(SQLException e) {
    return UNIQUE_VIOLATION.equals(e.getSQLState());
  }
}
