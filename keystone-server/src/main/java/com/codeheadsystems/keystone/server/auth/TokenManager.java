package com.codeheadsystems.keystone.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies JWT bearer tokens for authenticated accounts.
 * <p>
 * Tokens are signed with HMAC-SHA256 and carry the account id as subject plus the account
 * email, issued-at and expiry claims. Tokens are stateless: nothing is stored server-side,
 * and a token stays valid until it expires.
 */
public class TokenManager {

  /**
   * Minimum signing secret length in bytes for HMAC-SHA256.
   */
  public static final int MIN_SECRET_BYTES = 32;

  /**
   * Longest accepted token validity window: 366 days.
   */
  public static final long MAX_TTL_SECONDS = 31_622_400L;

  static final String EMAIL_CLAIM = "email";

  private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final long ttlSeconds;
  private final Clock clock;

  /**
   * Creates a new TokenManager using the system UTC clock.
   *
   * @param secret     HMAC-SHA256 signing secret, at least {@link #MIN_SECRET_BYTES} bytes
   * @param issuer     JWT issuer claim
   * @param ttlSeconds token validity window in seconds, at most {@link #MAX_TTL_SECONDS}
   */
  public TokenManager(byte[] secret, String issuer, long ttlSeconds) {
    this(secret, issuer, ttlSeconds, Clock.systemUTC());
  }

  /**
   * Creates a new TokenManager.
   *
   * @param secret     HMAC-SHA256 signing secret, at least {@link #MIN_SECRET_BYTES} bytes
   * @param issuer     JWT issuer claim
   * @param ttlSeconds token validity window in seconds, at most {@link #MAX_TTL_SECONDS}
   * @param clock      time source for issuing and checking expiry
   */
  public TokenManager(byte[] secret, String issuer, long ttlSeconds, Clock clock) {
    if (secret == null || secret.length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException(
          "Token signing secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    if (ttlSeconds < 1 || ttlSeconds > MAX_TTL_SECONDS) {
      throw new IllegalArgumentException(
          "Token TTL must be between 1 and " + MAX_TTL_SECONDS + " seconds");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer))
        .build(clock);
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
    this.clock = clock;
  }

  /**
   * Issues a token for an authenticated account.
   *
   * @param subjectId    account identifier
   * @param subjectEmail account email
   * @return signed JWT string
   */
  public String issueToken(String subjectId, String subjectEmail) {
    String jti = UUID.randomUUID().toString();
    Instant now = clock.instant();
    Instant expiresAt = now.plusSeconds(ttlSeconds);

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(subjectId)
        .withClaim(EMAIL_CLAIM, subjectEmail)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);
    log.debug("Issued JWT jti={} for account {}", jti, subjectId);
    return token;
  }

  /**
   * Result of a successful token verification.
   *
   * @param subjectId    the JWT subject (account id)
   * @param subjectEmail the account email claim
   * @param issuedAt     when the token was issued
   * @param expiresAt    when the token expires
   */
  public record VerifyResult(String subjectId, String subjectEmail, Instant issuedAt,
                             Instant expiresAt) {
  }

  /**
   * Verifies a token's structure, signature, issuer and expiry.
   *
   * @param token JWT string
   * @return the identity the token asserts
   * @throws TokenVerificationException if the token is not acceptable; see its kind
   */
  public VerifyResult verify(String token) {
    if (token == null || token.isBlank()) {
      throw new TokenVerificationException(TokenVerificationException.Kind.MALFORMED,
          "Token is missing", null);
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(token);
    } catch (JWTDecodeException e) {
      throw rejected(TokenVerificationException.Kind.MALFORMED, e);
    } catch (SignatureVerificationException | AlgorithmMismatchException e) {
      throw rejected(TokenVerificationException.Kind.INVALID_SIGNATURE, e);
    } catch (TokenExpiredException e) {
      throw rejected(TokenVerificationException.Kind.EXPIRED, e);
    } catch (JWTVerificationException e) {
      throw rejected(TokenVerificationException.Kind.INVALID_CLAIMS, e);
    }
    String subject = decoded.getSubject();
    String email = decoded.getClaim(EMAIL_CLAIM).asString();
    if (subject == null || email == null
        || decoded.getIssuedAtAsInstant() == null || decoded.getExpiresAtAsInstant() == null) {
      throw new TokenVerificationException(TokenVerificationException.Kind.MALFORMED,
          "Token is missing required claims", null);
    }
    return new VerifyResult(subject, email, decoded.getIssuedAtAsInstant(),
        decoded.getExpiresAtAsInstant());
  }

  private static TokenVerificationException rejected(TokenVerificationException.Kind kind,
                                                     JWTVerificationException e) {
    log.debug("JWT verification failed ({}): {}", kind, e.getMessage());
    return new TokenVerificationException(kind, e.getMessage(), e);
  }
}
