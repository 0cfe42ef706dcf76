package com.codeheadsystems.keystone.dropwizard;

import com.codeheadsystems.keystone.dropwizard.auth.KeystoneAuthenticator;
import com.codeheadsystems.keystone.dropwizard.auth.KeystonePrincipal;
import com.codeheadsystems.keystone.dropwizard.health.TokenSigningHealthCheck;
import com.codeheadsystems.keystone.server.auth.TokenManager;
import com.codeheadsystems.keystone.server.hash.Argon2idCredentialHasher;
import com.codeheadsystems.keystone.server.hash.CredentialHasher;
import com.codeheadsystems.keystone.server.manager.AuthenticationManager;
import com.codeheadsystems.keystone.server.resource.AuthFailureExceptionMapper;
import com.codeheadsystems.keystone.server.resource.AuthResource;
import com.codeheadsystems.keystone.server.store.AccountStore;
import com.codeheadsystems.keystone.server.store.InMemoryAccountStore;
import com.codeheadsystems.keystone.server.store.JdbcAccountStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import io.dropwizard.db.ManagedDataSource;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires keystone account authentication into an existing application.
 * <p>
 * Registers the signup/login resource, the bearer-token authentication filter and the
 * {@code token-signing} health check. Requires a {@link KeystoneConfiguration} block in the
 * application's YAML config. Protect your own routes with {@code @Auth KeystonePrincipal}.
 * <p>
 * Embed in your application and let the configuration pick the account store:
 * <pre>{@code
 *   bootstrap.addBundle(new KeystoneBundle<>());
 * }</pre>
 * <p>
 * Or supply your own store:
 * <pre>{@code
 *   bootstrap.addBundle(new KeystoneBundle<>(myAccountStore));
 * }</pre>
 */
public class KeystoneBundle<C extends KeystoneConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(KeystoneBundle.class);

  private final AccountStore suppliedAccountStore;

  /**
   * Creates a bundle whose account store comes from the configuration: JDBC when a
   * {@code database} block is present, in-memory otherwise.
   */
  public KeystoneBundle() {
    this.suppliedAccountStore = null;
  }

  /**
   * Creates a bundle backed by the supplied account store. Any {@code database} block in the
   * configuration is ignored.
   *
   * @param accountStore the account store
   */
  public KeystoneBundle(AccountStore accountStore) {
    this.suppliedAccountStore = accountStore;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    TokenManager tokenManager = buildTokenManager(configuration);
    CredentialHasher credentialHasher = new Argon2idCredentialHasher(
        configuration.getArgon2MemoryKib(),
        configuration.getArgon2Iterations(),
        configuration.getArgon2Parallelism());
    AccountStore accountStore = buildAccountStore(configuration, environment);

    AuthenticationManager authenticationManager =
        new AuthenticationManager(accountStore, credentialHasher, tokenManager);
    environment.jersey().register(new AuthResource(authenticationManager));
    environment.jersey().register(new AuthFailureExceptionMapper());
    environment.healthChecks().register("token-signing", new TokenSigningHealthCheck(tokenManager));

    // Bearer token auth filter
    KeystoneAuthenticator authenticator = new KeystoneAuthenticator(tokenManager);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<KeystonePrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(KeystonePrincipal.class));
  }

  private TokenManager buildTokenManager(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    if (secretHex == null || secretHex.isEmpty()) {
      throw new IllegalStateException(
          "jwtSecretHex must be configured. Generate a value with: openssl rand -hex 32");
    }
    byte[] secret;
    try {
      secret = HexFormat.of().parseHex(secretHex);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("jwtSecretHex is not valid hex", e);
    }
    if (secret.length < TokenManager.MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "jwtSecretHex must decode to at least " + TokenManager.MIN_SECRET_BYTES + " bytes");
    }
    return new TokenManager(secret, configuration.getJwtIssuer(), configuration.getJwtTtlSeconds());
  }

  private AccountStore buildAccountStore(C configuration, Environment environment) {
    if (suppliedAccountStore != null) {
      return suppliedAccountStore;
    }
    if (configuration.getDatabase() == null) {
      log.warn("""
          #################################################################
          # WARNING: No database configured. Accounts are kept in memory  #
          # and will be lost on restart. Do not use in production.        #
          #################################################################
          """);
      return new InMemoryAccountStore();
    }
    ManagedDataSource dataSource =
        configuration.getDatabase().build(environment.metrics(), "keystone-accounts");
    environment.lifecycle().manage(dataSource);
    JdbcAccountStore store = new JdbcAccountStore(dataSource);
    store.createSchema();
    return store;
  }
}
