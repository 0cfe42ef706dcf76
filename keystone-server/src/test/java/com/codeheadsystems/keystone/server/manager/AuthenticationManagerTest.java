package com.codeheadsystems.keystone.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.keystone.model.auth.AuthResponse;
import com.codeheadsystems.keystone.model.auth.LoginRequest;
import com.codeheadsystems.keystone.model.auth.RegisterRequest;
import com.codeheadsystems.keystone.server.auth.TokenManager;
import com.codeheadsystems.keystone.server.auth.TokenVerificationException;
import com.codeheadsystems.keystone.server.hash.Argon2idCredentialHasher;
import com.codeheadsystems.keystone.server.manager.AuthFailureException.Reason;
import com.codeheadsystems.keystone.server.store.InMemoryAccountStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Registration and login against real components with an in-memory store.
 */
class AuthenticationManagerTest {

  private static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes();
  private static final Instant NOW = Instant.parse("2024-01-15T10:30:00Z");
  private static final long TTL = 3600;
  private static final String PASSWORD = "correct-horse-battery";

  private InMemoryAccountStore accountStore;
  private TokenManager tokenManager;
  private AuthenticationManager manager;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    accountStore = new InMemoryAccountStore(clock);
    tokenManager = new TokenManager(SECRET, "test-issuer", TTL, clock);
    manager = new AuthenticationManager(accountStore,
        new Argon2idCredentialHasher(1024, 1, 1), tokenManager);
  }

  @Test
  void registerThenLogin_returnsSameAccount() {
    AuthResponse registered = manager.register(
        new RegisterRequest("user@example.com", PASSWORD, "User"));
    AuthResponse loggedIn = manager.login(new LoginRequest("user@example.com", PASSWORD));

    assertThat(loggedIn.user().id()).isEqualTo(registered.user().id());
    assertThat(loggedIn.user()).isEqualTo(registered.user());
    assertThat(registered.user().email()).isEqualTo("user@example.com");
    assertThat(registered.user().name()).isEqualTo("User");
    assertThat(registered.user().createdAt()).isEqualTo("2024-01-15T10:30:00Z");
  }

  @Test
  void register_tokenVerifiesToNewAccount() {
    AuthResponse registered = manager.register(
        new RegisterRequest("user@example.com", PASSWORD, null));

    TokenManager.VerifyResult result = tokenManager.verify(registered.token());

    assertThat(result.subjectId()).isEqualTo(registered.user().id());
    assertThat(result.subjectEmail()).isEqualTo("user@example.com");
  }

  @Test
  void login_tokenExpiresAfterValidityWindow() {
    manager.register(new RegisterRequest("user@example.com", PASSWORD, null));
    AuthResponse loggedIn = manager.login(new LoginRequest("user@example.com", PASSWORD));
    TokenManager later = new TokenManager(SECRET, "test-issuer", TTL,
        Clock.fixed(NOW.plusSeconds(TTL + 1), ZoneOffset.UTC));

    assertThatThrownBy(() -> later.verify(loggedIn.token()))
        .isInstanceOfSatisfying(TokenVerificationException.class,
            e -> assertThat(e.kind()).isEqualTo(TokenVerificationException.Kind.EXPIRED));
  }

  @Test
  void register_storesDigestNotPassword() {
    manager.register(new RegisterRequest("user@example.com", PASSWORD, null));

    String digest = accountStore.findByEmail("user@example.com").orElseThrow().passwordDigest();
    assertThat(digest).startsWith("$argon2id$").doesNotContain(PASSWORD);
  }

  @Test
  void register_sameEmailTwice_secondIsEmailTaken() {
    manager.register(new RegisterRequest("user@example.com", PASSWORD, null));

    assertFailure(() -> manager.register(new RegisterRequest("user@example.com", "another-password", null)),
        Reason.EMAIL_TAKEN);
  }

  @Test
  void register_emailDiffersOnlyByCase_isEmailTaken() {
    manager.register(new RegisterRequest("User@Example.com", PASSWORD, null));

    assertFailure(() -> manager.register(new RegisterRequest(" user@example.COM ", PASSWORD, null)),
        Reason.EMAIL_TAKEN);
  }

  @Test
  void register_emailIsStoredCanonical_andLoginIgnoresCase() {
    AuthResponse registered = manager.register(new RegisterRequest("User@Example.com", PASSWORD, null));

    assertThat(registered.user().email()).isEqualTo("user@example.com");
    assertThat(manager.login(new LoginRequest("USER@EXAMPLE.COM", PASSWORD)).user().id())
        .isEqualTo(registered.user().id());
  }

  @Test
  void register_concurrentSameEmail_exactlyOneSucceeds() throws Exception {
    int threads = 4;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<AuthResponse>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        Callable<AuthResponse> task = () -> {
          start.await();
          return manager.register(new RegisterRequest("race@example.com", PASSWORD, null));
        };
        futures.add(executor.submit(task));
      }
      start.countDown();

      int succeeded = 0;
      for (Future<AuthResponse> future : futures) {
        try {
          future.get();
          succeeded++;
        } catch (ExecutionException e) {
          assertThat(e.getCause()).isInstanceOfSatisfying(AuthFailureException.class,
              f -> assertThat(f.reason()).isEqualTo(Reason.EMAIL_TAKEN));
        }
      }
      assertThat(succeeded).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void register_invalidEmail_isInvalidEmail() {
    assertFailure(() -> manager.register(new RegisterRequest("no-at-sign.com", PASSWORD, null)),
        Reason.INVALID_EMAIL);
    assertFailure(() -> manager.register(new RegisterRequest("user@domain", PASSWORD, null)),
        Reason.INVALID_EMAIL);
    assertThat(accountStore.findByEmail("user@domain")).isEmpty();
  }

  @Test
  void register_shortPassword_isInvalidRequestAndCreatesNothing() {
    assertFailure(() -> manager.register(new RegisterRequest("user@example.com", "short", null)),
        Reason.INVALID_REQUEST);
    assertThat(accountStore.findByEmail("user@example.com")).isEmpty();
  }

  @Test
  void register_missingFields_isInvalidRequest() {
    assertFailure(() -> manager.register(null), Reason.INVALID_REQUEST);
    assertFailure(() -> manager.register(new RegisterRequest(null, PASSWORD, null)),
        Reason.INVALID_REQUEST);
    assertFailure(() -> manager.register(new RegisterRequest("user@example.com", null, null)),
        Reason.INVALID_REQUEST);
    assertFailure(() -> manager.register(new RegisterRequest("user@example.com", PASSWORD, "n".repeat(256))),
        Reason.INVALID_REQUEST);
  }

  @Test
  void login_wrongPassword_isInvalidCredentials() {
    manager.register(new RegisterRequest("user@example.com", PASSWORD, null));

    assertFailure(() -> manager.login(new LoginRequest("user@example.com", "wrong-password")),
        Reason.INVALID_CREDENTIALS);
  }

  @Test
  void login_unknownEmail_isSameFailureAsWrongPassword() {
    manager.register(new RegisterRequest("user@example.com", PASSWORD, null));

    AuthFailureException unknown = captureFailure(
        () -> manager.login(new LoginRequest("nobody@example.com", PASSWORD)));
    AuthFailureException wrong = captureFailure(
        () -> manager.login(new LoginRequest("user@example.com", "wrong-password")));

    assertThat(unknown.reason()).isEqualTo(Reason.INVALID_CREDENTIALS);
    assertThat(unknown.reason()).isEqualTo(wrong.reason());
    assertThat(unknown.getMessage()).isEqualTo(wrong.getMessage());
  }

  @Test
  void login_storedDigestCorrupt_isInvalidCredentials() {
    accountStore.create("user@example.com", "$argon2id$v=19$m=1024,t=1,p=1$c2FsdHNhbHQ$AAA", null);
    accountStore.create("other@example.com",
        "$argon2id$v=19$m=2147483647,t=1,p=1$c2FsdHNhbHQ$" + "A".repeat(43), null);

    assertFailure(() -> manager.login(new LoginRequest("user@example.com", PASSWORD)),
        Reason.INVALID_CREDENTIALS);
    assertFailure(() -> manager.login(new LoginRequest("other@example.com", PASSWORD)),
        Reason.INVALID_CREDENTIALS);
  }

  @Test
  void register_nonAsciiLetterThatLowerCasesToAscii_isInvalidEmail() {
    // KELVIN SIGN lower-cases to 'k' under Locale.ROOT
    assertFailure(() -> manager.register(new RegisterRequest("\u212A@example.com", PASSWORD, null)),
        Reason.INVALID_EMAIL);
    assertThat(accountStore.findByEmail("k@example.com")).isEmpty();
  }

  @Test
  void login_nonAsciiLookalikeOfExistingEmail_isInvalidCredentials() {
    manager.register(new RegisterRequest("k@example.com", PASSWORD, null));

    assertFailure(() -> manager.login(new LoginRequest("\u212A@example.com", PASSWORD)),
        Reason.INVALID_CREDENTIALS);
  }

  @Test
  void login_missingFields_isInvalidRequest() {
    assertFailure(() -> manager.login(null), Reason.INVALID_REQUEST);
    assertFailure(() -> manager.login(new LoginRequest(" ", PASSWORD)), Reason.INVALID_REQUEST);
    assertFailure(() -> manager.login(new LoginRequest("user@example.com", null)),
        Reason.INVALID_REQUEST);
  }

  private static void assertFailure(Runnable call, Reason reason) {
    assertThat(captureFailure(call).reason()).isEqualTo(reason);
  }

  private static AuthFailureException captureFailure(Runnable call) {
    try {
      call.run();
    } catch (AuthFailureException e) {
      return e;
    }
    throw new AssertionError("Expected AuthFailureException");
  }
}
