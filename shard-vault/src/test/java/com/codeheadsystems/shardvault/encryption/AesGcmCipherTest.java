package com.codeheadsystems.shardvault.encryption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AesGcmCipherTest {

  private AesGcmCipher cipher;
  private byte[] key;

  @BeforeEach
  void setup() {
    cipher = new AesGcmCipher(new SecureRandom());
    key = cipher.generateKey();
  }

  @Test
  void generateKey_is256Bits() {
    assertThat(key).hasSize(AesGcmCipher.KEY_LENGTH);
    assertThat(cipher.generateKey()).isNotEqualTo(key);
  }

  @Test
  void encrypt_decrypt_roundTrip() {
    final String encrypted = cipher.encrypt("sensitive data", key);
    assertThat(encrypted).doesNotContain("sensitive");
    assertThat(cipher.decrypt(encrypted, key)).isEqualTo("sensitive data");
  }

  @Test
  void encrypt_layout() {
    final byte[] raw = Base64.getDecoder().decode(cipher.encrypt("abc", key));
    // iv + 3 bytes of ciphertext + tag
    assertThat(raw).hasSize(12 + 3 + 16);
  }

  @Test
  void encrypt_freshIvEachTime() {
    assertThat(cipher.encrypt("same", key)).isNotEqualTo(cipher.encrypt("same", key));
  }

  @Test
  void decrypt_withWrongKey_fails() {
    final String encrypted = cipher.encrypt("sensitive", key);
    assertThatThrownBy(() -> cipher.decrypt(encrypted, cipher.generateKey()))
        .isInstanceOf(EncryptionException.class)
        .hasMessageContaining("Failed to decrypt");
  }

  @Test
  void decrypt_tampered_fails() {
    final byte[] raw = Base64.getDecoder().decode(cipher.encrypt("sensitive", key));
    raw[raw.length - 1] ^= 1;
    final String tampered = Base64.getEncoder().encodeToString(raw);
    assertThatThrownBy(() -> cipher.decrypt(tampered, key))
        .isInstanceOf(EncryptionException.class);
  }

  @Test
  void decrypt_truncated_fails() {
    final byte[] raw = Base64.getDecoder().decode(cipher.encrypt("sensitive", key));
    final String truncated = Base64.getEncoder().encodeToString(Arrays.copyOf(raw, 20));
    assertThatThrownBy(() -> cipher.decrypt(truncated, key))
        .isInstanceOf(EncryptionException.class)
        .hasMessageContaining("too short");
  }

  @Test
  void decrypt_notBase64_fails() {
    assertThatThrownBy(() -> cipher.decrypt("***", key))
        .isInstanceOf(EncryptionException.class)
        .hasMessageContaining("not base64");
  }

  @Test
  void invalidKeySize_fails() {
    assertThatThrownBy(() -> cipher.encrypt("data", new byte[16]))
        .isInstanceOf(EncryptionException.class)
        .hasMessageContaining("Key must be 32 bytes");
  }

}
