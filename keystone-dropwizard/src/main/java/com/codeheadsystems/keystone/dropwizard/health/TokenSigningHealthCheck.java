package com.codeheadsystems.keystone.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.keystone.server.auth.TokenManager;
import com.codeheadsystems.keystone.server.auth.TokenVerificationException;

/**
 * Health check that issues a probe token and verifies it with the configured signing key.
 */
public class TokenSigningHealthCheck extends HealthCheck {

  private static final String PROBE_SUBJECT = "health-probe";
  private static final String PROBE_EMAIL = "health-probe@keystone.invalid";

  private final TokenManager tokenManager;

  /**
   * Instantiates a new Token signing health check.
   *
   * @param tokenManager the token manager
   */
  public TokenSigningHealthCheck(TokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  protected Result check() {
    try {
      TokenManager.VerifyResult result =
          tokenManager.verify(tokenManager.issueToken(PROBE_SUBJECT, PROBE_EMAIL));
      if (!PROBE_SUBJECT.equals(result.subjectId())) {
        return Result.unhealthy("Probe token verified with unexpected subject");
      }
      return Result.healthy("probe token expires at %s", result.expiresAt());
    } catch (TokenVerificationException e) {
      return Result.unhealthy("Probe token rejected: %s", e.kind());
    }
  }
}
