package com.codeheadsystems.shardvault.compare;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HashAlgorithmTest {

  @Test
  void fromName() {
    assertThat(HashAlgorithm.fromName("md5")).contains(HashAlgorithm.MD5);
    assertThat(HashAlgorithm.fromName("SHA1")).contains(HashAlgorithm.SHA1);
    assertThat(HashAlgorithm.fromName("sha-256")).contains(HashAlgorithm.SHA256);
    assertThat(HashAlgorithm.fromName(" Sha512 ")).contains(HashAlgorithm.SHA512);
  }

  @Test
  void fromName_unknown() {
    assertThat(HashAlgorithm.fromName("crc32")).isEmpty();
    assertThat(HashAlgorithm.fromName(null)).isEmpty();
  }

  @Test
  void hexLength() {
    assertThat(HashAlgorithm.MD5.hexLength()).isEqualTo(32);
    assertThat(HashAlgorithm.SHA1.hexLength()).isEqualTo(40);
    assertThat(HashAlgorithm.SHA256.hexLength()).isEqualTo(64);
    assertThat(HashAlgorithm.SHA512.hexLength()).isEqualTo(128);
  }

}
