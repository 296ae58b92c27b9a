package com.codeheadsystems.shardvault.store;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process local store. Group operations hold the instance lock, so a record is never observed
 * half written through this store.
 */
@Singleton
public class InMemoryKeyValueStore implements KeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

  private final Map<String, String> slots;

  /**
   * Instantiates a new In memory key value store.
   */
  @Inject
  public InMemoryKeyValueStore() {
    log.info("InMemoryKeyValueStore()");
    this.slots = new ConcurrentHashMap<>();
  }

  @Override
  public Optional<String> get(final String name) {
    return Optional.ofNullable(slots.get(name));
  }

  @Override
  public void put(final String name, final String content) {
    slots.put(name, content);
  }

  @Override
  public void delete(final String name) {
    slots.remove(name);
  }

  @Override
  public synchronized Map<String, String> getMany(final Collection<String> names) {
    final Map<String, String> result = new HashMap<>();
    for (String name : names) {
      final String content = slots.get(name);
      if (content != null) {
        result.put(name, content);
      }
    }
    return result;
  }

  @Override
  public synchronized void putMany(final Map<String, String> values) {
    slots.putAll(values);
  }

  @Override
  public synchronized void deleteMany(final Collection<String> names) {
    names.forEach(slots::remove);
  }

}
