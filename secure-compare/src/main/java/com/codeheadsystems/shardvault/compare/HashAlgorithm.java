package com.codeheadsystems.shardvault.compare;

import java.util.Locale;
import java.util.Optional;

/**
 * Hash algorithms whose hex digests can be compared, with the digest length in hex characters.
 */
public enum HashAlgorithm {

  /**
   * Md5, 128 bits.
   */
  MD5(32, "md5"),
  /**
   * Sha1, 160 bits.
   */
  SHA1(40, "sha1", "sha-1"),
  /**
   * Sha256.
   */
  SHA256(64, "sha256", "sha-256"),
  /**
   * Sha512.
   */
  SHA512(128, "sha512", "sha-512");

  private final int hexLength;
  private final String[] names;

  HashAlgorithm(final int hexLength, final String... names) {
    this.hexLength = hexLength;
    this.names = names;
  }

  /**
   * Looks up an algorithm by name, ignoring case.
   *
   * @param name e.g. "sha256" or "SHA-256".
   * @return the algorithm, or empty if the name is unknown.
   */
  public static Optional<HashAlgorithm> fromName(final String name) {
    if (name == null) {
      return Optional.empty();
    }
    final String lower = name.trim().toLowerCase(Locale.ROOT);
    for (HashAlgorithm algorithm : values()) {
      for (String candidate : algorithm.names) {
        if (candidate.equals(lower)) {
          return Optional.of(algorithm);
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Length of the hex encoded digest.
   *
   * @return number of hex characters.
   */
  public int hexLength() {
    return hexLength;
  }

}
