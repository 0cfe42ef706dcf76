package com.codeheadsystems.keystone.server.manager;

import com.codeheadsystems.keystone.model.auth.AuthResponse;
import com.codeheadsystems.keystone.model.auth.LoginRequest;
import com.codeheadsystems.keystone.model.auth.RegisterRequest;
import com.codeheadsystems.keystone.server.auth.TokenManager;
import com.codeheadsystems.keystone.server.hash.CredentialHasher;
import com.codeheadsystems.keystone.server.model.Account;
import com.codeheadsystems.keystone.server.store.AccountStore;
import com.codeheadsystems.keystone.server.store.DuplicateEmailException;
import com.codeheadsystems.keystone.server.validation.EmailValidator;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic service implementing account registration and password login.
 * <p>
 * Framework adapters ({@code AuthResource} for JAX-RS / Dropwizard) stay thin wrappers that
 * translate exceptions into HTTP responses.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link AuthFailureException} with {@code INVALID_REQUEST} → HTTP 422</li>
 *   <li>{@link AuthFailureException} with {@code INVALID_EMAIL} or {@code EMAIL_TAKEN} → HTTP 400</li>
 *   <li>{@link AuthFailureException} with {@code INVALID_CREDENTIALS} → HTTP 401</li>
 *   <li>{@link com.codeheadsystems.keystone.server.store.AccountStoreException} → propagated, HTTP 500</li>
 * </ul>
 * The manager holds no mutable state; the {@link AccountStore} decides uniqueness.
 */
public class AuthenticationManager {

  /**
   * Minimum password length accepted at registration.
   */
  public static final int MIN_PASSWORD_LENGTH = 8;

  /**
   * Maximum length of the email and name fields.
   */
  public static final int MAX_FIELD_LENGTH = 255;

  private static final Logger log = LoggerFactory.getLogger(AuthenticationManager.class);

  private final AccountStore accountStore;
  private final CredentialHasher credentialHasher;
  private final TokenManager tokenManager;

  /**
   * Digest of a random password, checked when the email is unknown so that both login
   * failure paths spend the same hashing time.
   */
  private final String dummyDigest;

  /**
   * Instantiates a new Authentication manager.
   *
   * @param accountStore     the account store
   * @param credentialHasher the credential hasher
   * @param tokenManager     the token manager
   */
  public AuthenticationManager(AccountStore accountStore, CredentialHasher credentialHasher,
                               TokenManager tokenManager) {
    this.accountStore = accountStore;
    this.credentialHasher = credentialHasher;
    this.tokenManager = tokenManager;
    this.dummyDigest = credentialHasher.hash(UUID.randomUUID().toString());
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Registers a new account and issues a token for it.
   *
   * @param req the registration request
   * @return token and public account view
   * @throws AuthFailureException with {@code INVALID_REQUEST}, {@code INVALID_EMAIL} or
   *                              {@code EMAIL_TAKEN}
   */
  public AuthResponse register(RegisterRequest req) {
    log.debug("register()");
    if (req == null) {
      throw invalidRequest("Missing request body");
    }
    requireEmailField(req.email());
    if (req.password() == null || req.password().length() < MIN_PASSWORD_LENGTH) {
      throw invalidRequest("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
    }
    if (req.name() != null && req.name().length() > MAX_FIELD_LENGTH) {
      throw invalidRequest("Name must be at most " + MAX_FIELD_LENGTH + " characters");
    }

    String trimmed = req.email().trim();
    if (!EmailValidator.isValidEmail(trimmed)) {
      throw new AuthFailureException(AuthFailureException.Reason.INVALID_EMAIL,
          "Invalid email format");
    }
    String email = canonicalEmail(trimmed);
    if (accountStore.findByEmail(email).isPresent()) {
      throw emailTaken();
    }

    String digest = credentialHasher.hash(req.password());
    Account account;
    try {
      account = accountStore.create(email, digest, req.name());
    } catch (DuplicateEmailException e) {
      log.debug("Lost registration race for an email claimed concurrently");
      throw emailTaken();
    }
    log.info("Created account {}", account.id());
    return respond(account);
  }

  // ── Authentication ────────────────────────────────────────────────────────

  /**
   * Authenticates an existing account and issues a token for it.
   * <p>
   * An unknown email and a wrong password produce the same failure, and the unknown-email
   * path still runs a password verification so the two cannot be told apart by timing.
   *
   * @param req the login request
   * @return token and public account view
   * @throws AuthFailureException with {@code INVALID_REQUEST} or {@code INVALID_CREDENTIALS}
   */
  public AuthResponse login(LoginRequest req) {
    log.debug("login()");
    if (req == null) {
      throw invalidRequest("Missing request body");
    }
    requireEmailField(req.email());
    if (req.password() == null) {
      throw invalidRequest("Password is required");
    }

    // No account can hold an email that fails validation.
    String trimmed = req.email().trim();
    Optional<Account> found = EmailValidator.isValidEmail(trimmed)
        ? accountStore.findByEmail(canonicalEmail(trimmed))
        : Optional.empty();
    if (found.isEmpty()) {
      credentialHasher.verify(req.password(), dummyDigest);
      throw invalidCredentials();
    }
    Account account = found.get();
    if (!credentialHasher.verify(req.password(), account.passwordDigest())) {
      throw invalidCredentials();
    }
    if (credentialHasher.needsRehash(account.passwordDigest())) {
      log.info("Account {} has a password digest with outdated cost parameters", account.id());
    }
    return respond(account);
  }

  private AuthResponse respond(Account account) {
    String token = tokenManager.issueToken(account.id(), account.email());
    return new AuthResponse(token, account.toView());
  }

  private static void requireEmailField(String email) {
    if (email == null || email.isBlank()) {
      throw invalidRequest("Email is required");
    }
    if (email.length() > MAX_FIELD_LENGTH) {
      throw invalidRequest("Email must be at most " + MAX_FIELD_LENGTH + " characters");
    }
  }

  /**
   * Emails are stored and looked up trimmed and lower-cased. Only call with an email that
   * already passed {@link EmailValidator}, so lower-casing cannot map non-ASCII characters
   * (such as the Kelvin sign) onto ASCII ones.
   */
  static String canonicalEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }

  private static AuthFailureException invalidRequest(String message) {
    return new AuthFailureException(AuthFailureException.Reason.INVALID_REQUEST, message);
  }

  private static AuthFailureException emailTaken() {
    return new AuthFailureException(AuthFailureException.Reason.EMAIL_TAKEN,
        "Email already registered");
  }

  private static AuthFailureException invalidCredentials() {
    return new AuthFailureException(AuthFailureException.Reason.INVALID_CREDENTIALS,
        "Invalid email or password");
  }
}
