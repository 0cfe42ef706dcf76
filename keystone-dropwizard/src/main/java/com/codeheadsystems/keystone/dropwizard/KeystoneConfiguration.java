package com.codeheadsystems.keystone.dropwizard;

import com.codeheadsystems.keystone.server.auth.TokenManager;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import io.dropwizard.db.DataSourceFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for keystone account authentication.
 * <p>
 * {@code jwtSecretHex} is required: a hex-encoded HMAC-SHA256 key of at least 32 bytes,
 * generated with e.g. {@code openssl rand -hex 32}. There is no built-in default, so the key
 * never ships with the code.
 * <p>
 * When a {@code database} block is present, accounts are stored in the {@code accounts}
 * table of that database (created on startup if missing). Without it, and without a store
 * passed to the bundle, accounts are kept in memory (dev/test only).
 */
public class KeystoneConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for bearer tokens.
   */
  @NotEmpty
  private String jwtSecretHex;

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "keystone";

  /**
   * Token validity window in seconds. Defaults to 24 hours, at most 366 days.
   */
  @Min(1)
  @Max(TokenManager.MAX_TTL_SECONDS)
  private long jwtTtlSeconds = 86400;

  /**
   * Argon2id memory cost in kibibytes.
   */
  @Min(8)
  private int argon2MemoryKib = 65536;

  /**
   * Argon2id iteration count.
   */
  @Min(1)
  private int argon2Iterations = 3;

  /**
   * Argon2id parallelism.
   */
  @Min(1)
  private int argon2Parallelism = 1;

  @Valid
  private DataSourceFactory database;

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets jwt ttl seconds.
   *
   * @return the jwt ttl seconds
   */
  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  /**
   * Sets jwt ttl seconds.
   *
   * @param jwtTtlSeconds the jwt ttl seconds
   */
  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  @JsonProperty
  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  @JsonProperty
  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  @JsonProperty
  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  @JsonProperty
  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  @JsonProperty
  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  @JsonProperty
  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  /**
   * Gets the optional account database.
   *
   * @return the data source factory, or null when accounts are not kept in a database
   */
  @JsonProperty
  public DataSourceFactory getDatabase() {
    return database;
  }

  /**
   * Sets the optional account database.
   *
   * @param database the data source factory
   */
  @JsonProperty
  public void setDatabase(DataSourceFactory database) {
    this.database = database;
  }
}
