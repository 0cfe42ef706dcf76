package com.codeheadsystems.keystone.dropwizard.auth;

import com.codeheadsystems.keystone.server.auth.TokenManager;
import com.codeheadsystems.keystone.server.auth.TokenVerificationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that validates bearer tokens using {@link TokenManager}.
 * <p>
 * Any rejected token yields an unauthenticated request (HTTP 401); the rejection kind is
 * logged so expired tokens can be told apart from forged or corrupt ones.
 */
public class KeystoneAuthenticator implements Authenticator<String, KeystonePrincipal> {

  private static final Logger log = LoggerFactory.getLogger(KeystoneAuthenticator.class);

  private final TokenManager tokenManager;

  /**
   * Instantiates a new Keystone authenticator.
   *
   * @param tokenManager the token manager
   */
  public KeystoneAuthenticator(TokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  public Optional<KeystonePrincipal> authenticate(String token) {
    try {
      TokenManager.VerifyResult result = tokenManager.verify(token);
      return Optional.of(new KeystonePrincipal(result.subjectId(), result.subjectEmail()));
    } catch (TokenVerificationException e) {
      log.debug("Bearer token rejected: {}", e.kind());
      return Optional.empty();
    }
  }
}
