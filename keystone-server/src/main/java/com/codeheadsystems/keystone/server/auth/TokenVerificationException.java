package com.codeheadsystems.keystone.server.auth;

/**
 * Thrown by {@link TokenManager#verify} when a bearer token is not acceptable.
 * <p>
 * The {@link Kind} lets callers tell an expired token (prompt re-login) apart from a
 * corrupt or forged one (reject outright).
 */
public class TokenVerificationException extends SecurityException {

  /**
   * Why a token was rejected.
   */
  public enum Kind {
    /** Not a decodable token, or a required claim is missing. */
    MALFORMED,
    /** Signature or algorithm does not match the signing key. */
    INVALID_SIGNATURE,
    /** Signed correctly but a claim such as the issuer is wrong. */
    INVALID_CLAIMS,
    /** Past its expiry time. */
    EXPIRED
  }

  private final Kind kind;

  /**
   * Instantiates a new Token verification exception.
   *
   * @param kind    the failure kind
   * @param message the message
   * @param cause   the underlying cause, may be null
   */
  public TokenVerificationException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Kind kind.
   *
   * @return the kind
   */
  public Kind kind() {
    return kind;
  }
}
