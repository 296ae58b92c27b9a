package com.codeheadsystems.shardvault.utilities;

import java.util.ArrayList;
import java.util.List;

/**
 * Names of the slots that make up one record:
 * {prefix}{keyId}:enckey, {prefix}{keyId}:shard:{i} and, when enabled, {prefix}{keyId}:complete.
 */
public class SlotNames {

  private final String prefix;
  private final int shardCount;
  private final boolean completionMarker;

  /**
   * Instantiates a new Slot names.
   *
   * @param prefix           the prefix
   * @param shardCount       the shard count
   * @param completionMarker whether the marker slot is required
   */
  public SlotNames(final String prefix, final int shardCount, final boolean completionMarker) {
    this.prefix = prefix;
    this.shardCount = shardCount;
    this.completionMarker = completionMarker;
  }

  /**
   * Encryption key slot.
   *
   * @param keyId the key id
   * @return the string
   */
  public String encryptionKey(final String keyId) {
    return prefix + keyId + ":enckey";
  }

  /**
   * Shard slot.
   *
   * @param keyId the key id
   * @param index the index
   * @return the string
   */
  public String shard(final String keyId, final int index) {
    return prefix + keyId + ":shard:" + index;
  }

  /**
   * Completion marker slot.
   *
   * @param keyId the key id
   * @return the string
   */
  public String completionMarker(final String keyId) {
    return prefix + keyId + ":complete";
  }

  /**
   * Shard count.
   *
   * @return the int
   */
  public int shardCount() {
    return shardCount;
  }

  /**
   * Uses completion marker.
   *
   * @return the boolean
   */
  public boolean usesCompletionMarker() {
    return completionMarker;
  }

  /**
   * The key slot then the shard slots in index order.
   *
   * @param keyId the key id
   * @return the list
   */
  public List<String> recordSlots(final String keyId) {
    final List<String> names = new ArrayList<>(shardCount + 1);
    names.add(encryptionKey(keyId));
    for (int i = 0; i < shardCount; i++) {
      names.add(shard(keyId, i));
    }
    return names;
  }

  /**
   * Slots that must all exist for the record to be present.
   *
   * @param keyId the key id
   * @return the list
   */
  public List<String> requiredSlots(final String keyId) {
    final List<String> names = recordSlots(keyId);
    if (completionMarker) {
      names.add(completionMarker(keyId));
    }
    return names;
  }

  /**
   * Every slot that may belong to the record, marker included whether or not it is required.
   *
   * @param keyId the key id
   * @return the list
   */
  public List<String> allSlots(final String keyId) {
    final List<String> names = recordSlots(keyId);
    names.add(completionMarker(keyId));
    return names;
  }

}
