package com.codeheadsystems.shardvault.store;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * String slots addressed by name. Single slot operations are atomic. Whether the *Many
 * operations are atomic as a group is up to the implementation.
 *
 * <p>Every method throws {@link StorageException} if the medium fails.
 */
public interface KeyValueStore {

  /**
   * Get a slot.
   *
   * @param name the name
   * @return the content, if the slot exists.
   */
  Optional<String> get(String name);

  /**
   * Create or replace a slot.
   *
   * @param name    the name
   * @param content the content
   */
  void put(String name, String content);

  /**
   * Delete a slot if it exists.
   *
   * @param name the name
   */
  void delete(String name);

  /**
   * Get many slots.
   *
   * @param names the names
   * @return the slots that exist, keyed by name. Missing slots are absent from the map.
   */
  Map<String, String> getMany(Collection<String> names);

  /**
   * Create or replace many slots.
   *
   * @param slots content keyed by name.
   */
  void putMany(Map<String, String> slots);

  /**
   * Delete many slots. Names that do not exist are ignored.
   *
   * @param names the names
   */
  void deleteMany(Collection<String> names);

  /**
   * True if every named slot exists.
   *
   * @param names the names
   * @return the boolean
   */
  default boolean containsAll(final Collection<String> names) {
    return getMany(names).keySet().containsAll(names);
  }

  /**
   * True if any named slot exists.
   *
   * @param names the names
   * @return the boolean
   */
  default boolean containsAny(final Collection<String> names) {
    return !getMany(names).isEmpty();
  }

}
