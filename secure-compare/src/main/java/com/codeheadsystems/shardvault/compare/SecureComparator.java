package com.codeheadsystems.shardvault.compare;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Equality checks for security sensitive values (tokens, digests, signatures) whose running time
 * does not depend on where the inputs first differ.
 *
 * <p>Only the byte comparison is constant time. Format validation in the hex, base64 and hash
 * variants rejects malformed input early, and a length mismatch is the one signal that may leak.
 *
 * <p>None of these methods throw. Any internal failure is reported as {@code false}.
 */
public final class SecureComparator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SecureComparator.class);

  private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]*$");
  private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]*={0,2}$");

  private SecureComparator() {
  }

  /**
   * Compares two strings by their UTF-8 bytes in constant time.
   *
   * @param a first value.
   * @param b second value.
   * @return true if both are non-null and equal.
   */
  public static boolean secureCompare(final String a, final String b) {
    if (a == null || b == null) {
      return false;
    }
    try {
      return secureCompare(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    } catch (RuntimeException e) {
      LOGGER.warn("secureCompare(): unable to compare values: {}", e.getClass().getSimpleName());
      return false;
    }
  }

  /**
   * Compares two byte arrays in time that depends only on the longer length. The shorter input
   * is zero padded and the full comparison always runs, even when the lengths differ.
   *
   * @param a first value.
   * @param b second value.
   * @return true if both are non-null, the same length and hold the same bytes.
   */
  public static boolean secureCompare(final byte[] a, final byte[] b) {
    if (a == null || b == null) {
      return false;
    }
    final int length = Math.max(a.length, b.length);
    final byte[] left = Arrays.copyOf(a, length);
    final byte[] right = Arrays.copyOf(b, length);
    final boolean sameContent = Arrays.constantTimeAreEqual(length, left, 0, right, 0);
    return (a.length == b.length) & sameContent;
  }

  /**
   * Compares two hex strings. Both must be well formed hex (even length, [0-9a-fA-F]) or the
   * result is false without comparing. Case is significant.
   *
   * @param a first hex value.
   * @param b second hex value.
   * @return true if both are valid hex and equal.
   */
  public static boolean secureHexCompare(final String a, final String b) {
    if (!isHex(a) || !isHex(b)) {
      return false;
    }
    return secureCompare(a, b);
  }

  /**
   * Compares two standard alphabet base64 strings. Malformed input returns false immediately.
   *
   * @param a first base64 value.
   * @param b second base64 value.
   * @return true if both are valid base64 and equal.
   */
  public static boolean secureBase64Compare(final String a, final String b) {
    if (!isBase64(a) || !isBase64(b)) {
      return false;
    }
    return secureCompare(a, b);
  }

  /**
   * Compares two hex digests, requiring both to be exactly the digest length of the algorithm.
   *
   * @param a         first digest.
   * @param b         second digest.
   * @param algorithm md5, sha1, sha256 or sha512 (case insensitive, dashes allowed).
   * @return true if the algorithm is known, both digests have its length and are equal.
   */
  public static boolean secureHashCompare(final String a, final String b, final String algorithm) {
    return HashAlgorithm.fromName(algorithm)
        .map(hashAlgorithm -> secureHashCompare(a, b, hashAlgorithm))
        .orElse(false);
  }

  /**
   * Compares two hex digests of the given algorithm.
   *
   * @param a         first digest.
   * @param b         second digest.
   * @param algorithm the algorithm.
   * @return true if both digests have the algorithm's length and are equal.
   */
  public static boolean secureHashCompare(final String a, final String b, final HashAlgorithm algorithm) {
    if (a == null || b == null || algorithm == null) {
      return false;
    }
    if (a.length() != algorithm.hexLength() || b.length() != algorithm.hexLength()) {
      return false;
    }
    return secureHexCompare(a, b);
  }

  static boolean isHex(final String value) {
    return value != null && value.length() % 2 == 0 && HEX.matcher(value).matches();
  }

  static boolean isBase64(final String value) {
    return value != null && value.length() % 4 == 0 && BASE64.matcher(value).matches();
  }

}
