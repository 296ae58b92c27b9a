package com.codeheadsystems.shardvault.converter;

import com.codeheadsystems.shardvault.model.SecretRecord;
import com.codeheadsystems.shardvault.utilities.SlotNames;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a record to its slots and back.
 */
@Singleton
public class SecretRecordConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(SecretRecordConverter.class);

  private final SlotNames slotNames;

  /**
   * Instantiates a new Secret record converter.
   *
   * @param slotNames the slot names
   */
  @Inject
  public SecretRecordConverter(final SlotNames slotNames) {
    this.slotNames = slotNames;
  }

  /**
   * Slots for the record, key slot first.
   *
   * @param record the record
   * @return content keyed by slot name
   */
  public Map<String, String> toSlots(final SecretRecord record) {
    if (record.shards().size() != slotNames.shardCount()) {
      throw new IllegalArgumentException("Record has " + record.shards().size()
          + " shards, expected " + slotNames.shardCount());
    }
    final Map<String, String> slots = new LinkedHashMap<>();
    slots.put(slotNames.encryptionKey(record.keyId()), record.encryptionKey());
    for (int i = 0; i < record.shards().size(); i++) {
      slots.put(slotNames.shard(record.keyId(), i), record.shards().get(i));
    }
    return slots;
  }

  /**
   * Rebuild the record. Any missing slot means no record.
   *
   * @param keyId the key id
   * @param slots content keyed by slot name
   * @return the record if every slot is present
   */
  public Optional<SecretRecord> fromSlots(final String keyId, final Map<String, String> slots) {
    final String encryptionKey = slots.get(slotNames.encryptionKey(keyId));
    if (encryptionKey == null) {
      LOGGER.debug("fromSlots({}): no encryption key", keyId);
      return Optional.empty();
    }
    final List<String> shards = new ArrayList<>(slotNames.shardCount());
    for (int i = 0; i < slotNames.shardCount(); i++) {
      final String shard = slots.get(slotNames.shard(keyId, i));
      if (shard == null) {
        LOGGER.debug("fromSlots({}): missing shard {}", keyId, i);
        return Optional.empty();
      }
      shards.add(shard);
    }
    return Optional.of(SecretRecord.of(keyId, encryptionKey, shards));
  }

}
