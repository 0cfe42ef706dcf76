package com.codeheadsystems.keystone.server.manager;

/**
 * A registration or login that was evaluated and refused.
 * <p>
 * Each {@link Reason} is a distinct, user-facing outcome. Infrastructure problems are never
 * reported through this exception.
 */
public class AuthFailureException extends RuntimeException {

  /**
   * Why the request was refused.
   */
  public enum Reason {
    /** Required field missing, too short or too long. */
    INVALID_REQUEST,
    /** Email is not syntactically valid. */
    INVALID_EMAIL,
    /** Email already belongs to an account. */
    EMAIL_TAKEN,
    /** Unknown email or wrong password; deliberately not told apart. */
    INVALID_CREDENTIALS
  }

  private final Reason reason;

  /**
   * Instantiates a new Auth failure exception.
   *
   * @param reason  the reason
   * @param message the message
   */
  public AuthFailureException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  /**
   * Reason reason.
   *
   * @return the reason
   */
  public Reason reason() {
    return reason;
  }
}
