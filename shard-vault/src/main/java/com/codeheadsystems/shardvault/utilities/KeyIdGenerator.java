package com.codeheadsystems.shardvault.utilities;

import java.security.SecureRandom;
import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds keyIds of the form {service}-{epoch millis}-{8 base36 characters}.
 *
 * <p>The random suffix carries about 41 bits. Uniqueness is not guaranteed by generation alone;
 * the vault checks for existing slots before writing.
 */
@Singleton
public class KeyIdGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyIdGenerator.class);
  private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
  private static final int SUFFIX_LENGTH = 8;

  private final Clock clock;
  private final SecureRandom secureRandom;

  /**
   * Instantiates a new Key id generator.
   *
   * @param clock        the clock
   * @param secureRandom the secure random
   */
  @Inject
  public KeyIdGenerator(final Clock clock,
                        final SecureRandom secureRandom) {
    LOGGER.info("KeyIdGenerator({},{})", clock, secureRandom);
    this.clock = clock;
    this.secureRandom = secureRandom;
  }

  /**
   * Generate a key id.
   *
   * @param service the service label
   * @return the key id
   */
  public String generate(final String service) {
    final char[] suffix = new char[SUFFIX_LENGTH];
    for (int i = 0; i < SUFFIX_LENGTH; i++) {
      suffix[i] = ALPHABET[secureRandom.nextInt(ALPHABET.length)];
    }
    return service + "-" + clock.millis() + "-" + new String(suffix);
  }

}
