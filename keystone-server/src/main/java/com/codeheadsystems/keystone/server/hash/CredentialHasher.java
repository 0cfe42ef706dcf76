package com.codeheadsystems.keystone.server.hash;

/**
 * One-way transformation of a plaintext password into a storage-safe digest.
 * <p>
 * Implementations must salt every digest with fresh randomness, so two calls to {@link #hash}
 * with the same input produce different digests, and the digest must describe the parameters
 * it was made with so that cost changes do not break previously stored digests.
 * Implementations must be thread-safe.
 */
public interface CredentialHasher {

  /**
   * Hashes the password with a fresh random salt.
   *
   * @param password plaintext password, must not be null or empty
   * @return the self-describing digest
   * @throws IllegalArgumentException if the password is null or empty
   */
  String hash(String password);

  /**
   * Checks a plaintext password against a stored digest in constant time.
   * <p>
   * Never throws: a null argument or a malformed digest yields {@code false}.
   *
   * @param password plaintext password
   * @param digest   digest previously produced by {@link #hash}
   * @return true if the password matches
   */
  boolean verify(String password, String digest);

  /**
   * Returns true when the digest was made with parameters other than the current ones.
   *
   * @param digest stored digest
   * @return true if the digest should be regenerated at the next opportunity
   */
  boolean needsRehash(String digest);
}
