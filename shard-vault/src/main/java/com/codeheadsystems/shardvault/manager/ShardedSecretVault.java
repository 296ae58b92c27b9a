package com.codeheadsystems.shardvault.manager;

import com.codeheadsystems.shardvault.SecretVault;
import com.codeheadsystems.shardvault.converter.SecretRecordConverter;
import com.codeheadsystems.shardvault.encryption.AesGcmCipher;
import com.codeheadsystems.shardvault.encryption.EncryptionException;
import com.codeheadsystems.shardvault.exception.VaultError;
import com.codeheadsystems.shardvault.exception.VaultException;
import com.codeheadsystems.shardvault.model.SecretRecord;
import com.codeheadsystems.shardvault.model.VaultConfiguration;
import com.codeheadsystems.shardvault.store.KeyValueStore;
import com.codeheadsystems.shardvault.store.StorageException;
import com.codeheadsystems.shardvault.utilities.KeyIdGenerator;
import com.codeheadsystems.shardvault.utilities.ShardSplitter;
import com.codeheadsystems.shardvault.utilities.SlotNames;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts each secret under its own AES-256-GCM key, splits the encoded ciphertext into shards,
 * and writes the key and the shards to separate slots.
 *
 * <p>Missing slots, undecodable content and failed authentication all collapse into an empty
 * result. Only failures of the storage medium are reported, as {@link VaultException}.
 */
@Singleton
public class ShardedSecretVault implements SecretVault {

  /**
   * Longest accepted service label. It becomes part of every slot name.
   */
  public static final int MAX_SERVICE_LENGTH = 256;

  private static final Logger LOGGER = LoggerFactory.getLogger(ShardedSecretVault.class);
  private static final String COMPLETE = "1";

  private final KeyValueStore store;
  private final AesGcmCipher cipher;
  private final ShardSplitter shardSplitter;
  private final KeyIdGenerator keyIdGenerator;
  private final SlotNames slotNames;
  private final SecretRecordConverter converter;
  private final VaultConfiguration configuration;

  /**
   * Instantiates a new Sharded secret vault.
   *
   * @param store          the store
   * @param cipher         the cipher
   * @param shardSplitter  the shard splitter
   * @param keyIdGenerator the key id generator
   * @param slotNames      the slot names
   * @param converter      the converter
   * @param configuration  the configuration
   */
  @Inject
  public ShardedSecretVault(final KeyValueStore store,
                            final AesGcmCipher cipher,
                            final ShardSplitter shardSplitter,
                            final KeyIdGenerator keyIdGenerator,
                            final SlotNames slotNames,
                            final SecretRecordConverter converter,
                            final VaultConfiguration configuration) {
    LOGGER.info("ShardedSecretVault({}, {})", store, configuration);
    this.store = store;
    this.cipher = cipher;
    this.shardSplitter = shardSplitter;
    this.keyIdGenerator = keyIdGenerator;
    this.slotNames = slotNames;
    this.converter = converter;
    this.configuration = configuration;
  }

  @Override
  public String storeKey(final String service, final String secret) {
    LOGGER.trace("storeKey({})", service);
    if (service == null || service.isBlank()) {
      throw new IllegalArgumentException("service is required");
    }
    if (service.length() > MAX_SERVICE_LENGTH) {
      throw new IllegalArgumentException("service longer than " + MAX_SERVICE_LENGTH + " characters");
    }
    if (secret == null) {
      throw new IllegalArgumentException("secret is required");
    }
    final String keyId = unusedKeyId(service);
    final byte[] key = cipher.generateKey();
    final SecretRecord record;
    try {
      final String ciphertext = cipher.encrypt(secret, key);
      record = SecretRecord.of(keyId,
          Base64.getEncoder().encodeToString(key),
          shardSplitter.split(ciphertext, slotNames.shardCount()));
    } finally {
      Arrays.fill(key, (byte) 0);
    }
    final Map<String, String> slots = converter.toSlots(record);
    final Map<String, String> previous = configuration.enforceUniqueKeyIds()
        ? Map.of()
        : storage("read " + keyId, () -> store.getMany(slotNames.allSlots(keyId)));
    try {
      store.putMany(slots);
      if (slotNames.usesCompletionMarker()) {
        store.put(slotNames.completionMarker(keyId), COMPLETE);
      }
    } catch (StorageException e) {
      LOGGER.error("storeKey({}): write failed, removing partial record", keyId, e);
      rollback(keyId, previous, e);
      throw new VaultException(VaultError.STORAGE_FAILURE, "Failed to store secret " + keyId, e);
    }
    LOGGER.debug("storeKey({}): stored {} shards", keyId, record.shards().size());
    return keyId;
  }

  @Override
  public Optional<String> retrieveKey(final String keyId) {
    LOGGER.trace("retrieveKey({})", keyId);
    if (!verifyKey(keyId)) {
      return Optional.empty();
    }
    final Map<String, String> slots = storage("retrieve " + keyId,
        () -> store.getMany(slotNames.recordSlots(keyId)));
    final Optional<SecretRecord> record = converter.fromSlots(keyId, slots);
    if (record.isEmpty()) {
      LOGGER.warn("retrieveKey({}): record changed while reading", keyId);
      return Optional.empty();
    }
    return decrypt(record.get());
  }

  @Override
  public boolean verifyKey(final String keyId) {
    LOGGER.trace("verifyKey({})", keyId);
    if (keyId == null || keyId.isEmpty()) {
      return false;
    }
    return storage("verify " + keyId, () -> store.containsAll(slotNames.requiredSlots(keyId)));
  }

  @Override
  public boolean deleteKey(final String keyId) {
    LOGGER.trace("deleteKey({})", keyId);
    if (keyId == null || keyId.isEmpty()) {
      return true;
    }
    try {
      if (slotNames.usesCompletionMarker()) {
        store.delete(slotNames.completionMarker(keyId));
      }
      store.deleteMany(slotNames.allSlots(keyId));
      return true;
    } catch (StorageException e) {
      LOGGER.error("deleteKey({}): failed", keyId, e);
      return false;
    }
  }

  private Optional<String> decrypt(final SecretRecord record) {
    try {
      final byte[] key = Base64.getDecoder().decode(record.encryptionKey());
      try {
        return Optional.of(cipher.decrypt(shardSplitter.combine(record.shards()), key));
      } finally {
        Arrays.fill(key, (byte) 0);
      }
    } catch (IllegalArgumentException | EncryptionException e) {
      LOGGER.warn("retrieveKey({}): record is unreadable", record.keyId());
      return Optional.empty();
    }
  }

  private String unusedKeyId(final String service) {
    if (!configuration.enforceUniqueKeyIds()) {
      return keyIdGenerator.generate(service);
    }
    for (int attempt = 1; attempt <= configuration.maxKeyIdAttempts(); attempt++) {
      final String keyId = keyIdGenerator.generate(service);
      final List<String> names = slotNames.allSlots(keyId);
      if (!storage("check " + keyId, () -> store.containsAny(names))) {
        return keyId;
      }
      LOGGER.warn("unusedKeyId({}): {} already in use, attempt {}", service, keyId, attempt);
    }
    throw new VaultException(VaultError.KEY_ID_COLLISION,
        "No unused keyId after " + configuration.maxKeyIdAttempts() + " attempts for " + service);
  }

  private void rollback(final String keyId,
                        final Map<String, String> previous,
                        final StorageException cause) {
    try {
      store.deleteMany(slotNames.allSlots(keyId));
      if (!previous.isEmpty()) {
        store.putMany(previous);
      }
    } catch (StorageException e) {
      LOGGER.error("rollback({}): partial record left behind", keyId);
      cause.addSuppressed(e);
    }
  }

  private <T> T storage(final String operation, final Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (StorageException e) {
      LOGGER.error("{}: storage failure", operation, e);
      throw new VaultException(VaultError.STORAGE_FAILURE, "Storage failure during " + operation, e);
    }
  }

}
