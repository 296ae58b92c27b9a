package com.codeheadsystems.shardvault.encryption;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-256-GCM with a fresh key per secret.
 *
 * <p>Encrypted format, base64 encoded: [12-byte IV][ciphertext][16-byte authentication tag]</p>
 */
@Singleton
public class AesGcmCipher {

  /**
   * Raw key length in bytes.
   */
  public static final int KEY_LENGTH = 32;

  private static final Logger log = LoggerFactory.getLogger(AesGcmCipher.class);

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_IV_LENGTH = 12; // 96 bits
  private static final int GCM_TAG_LENGTH = 128; // 128 bits
  private static final int AES_KEY_SIZE = 256; // 256 bits

  private final SecureRandom secureRandom;

  /**
   * Instantiates a new AES-GCM cipher.
   *
   * @param secureRandom source of keys and IVs
   */
  @Inject
  public AesGcmCipher(final SecureRandom secureRandom) {
    log.info("AesGcmCipher({})", secureRandom);
    this.secureRandom = secureRandom;
  }

  /**
   * Generates a random AES-256 key.
   *
   * @return the raw key bytes
   */
  public byte[] generateKey() {
    try {
      final KeyGenerator keyGen = KeyGenerator.getInstance("AES");
      keyGen.init(AES_KEY_SIZE, secureRandom);
      return keyGen.generateKey().getEncoded();
    } catch (GeneralSecurityException e) {
      throw new EncryptionException("Failed to generate key", e);
    }
  }

  /**
   * Encrypts the UTF-8 bytes of the plaintext.
   *
   * @param plaintext the plaintext
   * @param key       the raw key
   * @return base64 of IV and ciphertext
   */
  public String encrypt(final String plaintext, final byte[] key) {
    try {
      final byte[] iv = new byte[GCM_IV_LENGTH];
      secureRandom.nextBytes(iv);

      final Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, secretKey(key), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      final byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

      final byte[] encrypted = ByteBuffer.allocate(GCM_IV_LENGTH + ciphertext.length)
          .put(iv)
          .put(ciphertext)
          .array();
      return Base64.getEncoder().encodeToString(encrypted);
    } catch (GeneralSecurityException e) {
      throw new EncryptionException("Failed to encrypt", e);
    }
  }

  /**
   * Decrypts and authenticates.
   *
   * @param encoded base64 of IV and ciphertext
   * @param key     the raw key
   * @return the plaintext
   * @throws EncryptionException if the data is malformed, tampered with, or the key is wrong.
   */
  public String decrypt(final String encoded, final byte[] key) {
    final byte[] encrypted;
    try {
      encrypted = Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new EncryptionException("Encrypted data is not base64", e);
    }
    if (encrypted.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
      throw new EncryptionException("Encrypted data is too short");
    }
    try {
      final byte[] iv = Arrays.copyOfRange(encrypted, 0, GCM_IV_LENGTH);
      final Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, secretKey(key), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      final byte[] plaintext = cipher.doFinal(encrypted, GCM_IV_LENGTH, encrypted.length - GCM_IV_LENGTH);
      return new String(plaintext, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new EncryptionException("Failed to decrypt", e);
    }
  }

  private SecretKey secretKey(final byte[] key) {
    if (key == null || key.length != KEY_LENGTH) {
      throw new EncryptionException("Key must be " + KEY_LENGTH + " bytes (256 bits) for AES-256");
    }
    return new SecretKeySpec(key, "AES");
  }

}
