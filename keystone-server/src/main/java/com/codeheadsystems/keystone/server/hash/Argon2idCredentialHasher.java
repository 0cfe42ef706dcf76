package com.codeheadsystems.keystone.server.hash;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Argon2id {@link CredentialHasher} producing PHC-format digests.
 * <p>
 * Digest layout: {@code $argon2id$v=19$m=<memoryKib>,t=<iterations>,p=<parallelism>$<salt>$<hash>}
 * with salt and hash in unpadded standard base64. Verification always uses the parameters
 * embedded in the digest, so raising the cost later does not invalidate stored digests.
 * <p>
 * Parsing is bounded: salts shorter than 8 bytes, hashes outside 4..64 bytes and parameters
 * Argon2 cannot run are rejected, and a digest whose cost exceeds {@value #MAX_COST_FACTOR}
 * times the configured cost is not evaluated at all. All of these verify as {@code false}.
 */
public class Argon2idCredentialHasher implements CredentialHasher {

  private static final Logger log = LoggerFactory.getLogger(Argon2idCredentialHasher.class);

  private static final String ALGORITHM = "argon2id";
  private static final int SALT_LENGTH = 16;
  private static final int HASH_LENGTH = 32;
  private static final int MIN_SALT_LENGTH = 8;
  private static final int MIN_HASH_LENGTH = 4;
  private static final int MAX_HASH_LENGTH = 64;
  private static final int MAX_PARALLELISM = (1 << 24) - 1;

  /**
   * Stored digests may cost at most this multiple of the configured parameters to verify.
   */
  static final int MAX_COST_FACTOR = 4;
  private static final Base64.Encoder B64 = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final int memoryKib;
  private final int iterations;
  private final int parallelism;
  private final SecureRandom random;

  /**
   * Instantiates a new hasher with the given cost parameters.
   *
   * @param memoryKib   Argon2 memory cost in kibibytes
   * @param iterations  Argon2 time cost
   * @param parallelism Argon2 lanes
   */
  public Argon2idCredentialHasher(int memoryKib, int iterations, int parallelism) {
    this(memoryKib, iterations, parallelism, new SecureRandom());
  }

  /**
   * Instantiates a new hasher with the given cost parameters and salt source.
   *
   * @param memoryKib   Argon2 memory cost in kibibytes
   * @param iterations  Argon2 time cost
   * @param parallelism Argon2 lanes
   * @param random      source of salts
   */
  public Argon2idCredentialHasher(int memoryKib, int iterations, int parallelism, SecureRandom random) {
    if (iterations < 1) {
      throw new IllegalArgumentException("Argon2 iterations must be at least 1");
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("Argon2 parallelism must be at least 1");
    }
    if (memoryKib < 8 * parallelism) {
      throw new IllegalArgumentException("Argon2 memory must be at least 8 KiB per lane");
    }
    this.memoryKib = memoryKib;
    this.iterations = iterations;
    this.parallelism = parallelism;
    this.random = random;
  }

  @Override
  public String hash(String password) {
    if (password == null || password.isEmpty()) {
      throw new IllegalArgumentException("Password cannot be null or empty");
    }
    byte[] salt = new byte[SALT_LENGTH];
    random.nextBytes(salt);
    byte[] hash = derive(password, salt, memoryKib, iterations, parallelism, HASH_LENGTH);
    return "$" + ALGORITHM
        + "$v=" + Argon2Parameters.ARGON2_VERSION_13
        + "$m=" + memoryKib + ",t=" + iterations + ",p=" + parallelism
        + "$" + B64.encodeToString(salt)
        + "$" + B64.encodeToString(hash);
  }

  @Override
  public boolean verify(String password, String digest) {
    if (password == null || digest == null) {
      return false;
    }
    PhcDigest parsed;
    try {
      parsed = PhcDigest.parse(digest);
    } catch (IllegalArgumentException e) {
      log.debug("Rejecting malformed digest: {}", e.getMessage());
      return false;
    }
    if (exceedsCostLimit(parsed)) {
      log.warn("Rejecting digest with cost m={},t={},p={} above the verification limit",
          parsed.memoryKib(), parsed.iterations(), parsed.parallelism());
      return false;
    }
    byte[] candidate;
    try {
      candidate = derive(password, parsed.salt(), parsed.memoryKib(), parsed.iterations(),
          parsed.parallelism(), parsed.hash().length);
    } catch (RuntimeException e) {
      log.warn("Rejecting digest that Argon2 could not evaluate: {}", e.getMessage());
      return false;
    }
    return MessageDigest.isEqual(candidate, parsed.hash());
  }

  private boolean exceedsCostLimit(PhcDigest parsed) {
    return parsed.memoryKib() > (long) memoryKib * MAX_COST_FACTOR
        || parsed.iterations() > (long) iterations * MAX_COST_FACTOR
        || parsed.parallelism() > (long) parallelism * MAX_COST_FACTOR;
  }

  @Override
  public boolean needsRehash(String digest) {
    if (digest == null) {
      return true;
    }
    try {
      PhcDigest parsed = PhcDigest.parse(digest);
      return parsed.memoryKib() != memoryKib
          || parsed.iterations() != iterations
          || parsed.parallelism() != parallelism;
    } catch (IllegalArgumentException e) {
      return true;
    }
  }

  private static byte[] derive(String password, byte[] salt, int memoryKib, int iterations,
                               int parallelism, int length) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(memoryKib)
        .withIterations(iterations)
        .withParallelism(parallelism)
        .build();
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    gen.init(params);
    byte[] secret = password.getBytes(StandardCharsets.UTF_8);
    byte[] output = new byte[length];
    try {
      gen.generateBytes(secret, output, 0, output.length);
    } finally {
      Arrays.fill(secret, (byte) 0);
    }
    return output;
  }

  /**
   * Parsed fields of a PHC-format Argon2id digest.
   */
  private record PhcDigest(int memoryKib, int iterations, int parallelism, byte[] salt, byte[] hash) {

    static PhcDigest parse(String digest) {
      String[] parts = digest.split("\\$");
      // "", "argon2id", "v=19", "m=..,t=..,p=..", salt, hash
      if (parts.length != 6 || !parts[0].isEmpty() || !ALGORITHM.equals(parts[1])) {
        throw new IllegalArgumentException("not an argon2id digest");
      }
      if (!("v=" + Argon2Parameters.ARGON2_VERSION_13).equals(parts[2])) {
        throw new IllegalArgumentException("unsupported argon2 version");
      }
      int memory = -1;
      int time = -1;
      int lanes = -1;
      for (String param : parts[3].split(",")) {
        String[] kv = param.split("=", 2);
        if (kv.length != 2) {
          throw new IllegalArgumentException("bad parameter " + param);
        }
        int value = parsePositive(kv[1]);
        switch (kv[0]) {
          case "m" -> memory = value;
          case "t" -> time = value;
          case "p" -> lanes = value;
          default -> throw new IllegalArgumentException("unknown parameter " + kv[0]);
        }
      }
      if (memory < 0 || time < 0 || lanes < 0) {
        throw new IllegalArgumentException("missing cost parameter");
      }
      if (lanes > MAX_PARALLELISM) {
        throw new IllegalArgumentException("parallelism above " + MAX_PARALLELISM);
      }
      if (memory < 8L * lanes) {
        throw new IllegalArgumentException("memory below 8 KiB per lane");
      }
      byte[] salt = B64D.decode(parts[4]);
      byte[] hash = B64D.decode(parts[5]);
      if (salt.length < MIN_SALT_LENGTH) {
        throw new IllegalArgumentException("salt shorter than " + MIN_SALT_LENGTH + " bytes");
      }
      if (hash.length < MIN_HASH_LENGTH || hash.length > MAX_HASH_LENGTH) {
        throw new IllegalArgumentException("hash length " + hash.length + " out of range");
      }
      return new PhcDigest(memory, time, lanes, salt, hash);
    }

    private static int parsePositive(String value) {
      try {
        int parsed = Integer.parseInt(value);
        if (parsed < 1) {
          throw new IllegalArgumentException("non-positive parameter " + value);
        }
        return parsed;
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("non-numeric parameter " + value, e);
      }
    }
  }
}
