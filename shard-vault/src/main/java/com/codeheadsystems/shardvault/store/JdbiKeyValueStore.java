package com.codeheadsystems.shardvault.store;

import com.codeheadsystems.shardvault.dao.SlotDao;
import com.codeheadsystems.shardvault.model.Slot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slots in the VAULT_SLOT table. The *Many operations run in one transaction, so a record is
 * written or removed as a whole.
 */
@Singleton
public class JdbiKeyValueStore implements KeyValueStore {

  private static final Logger log = LoggerFactory.getLogger(JdbiKeyValueStore.class);

  private final Jdbi jdbi;
  private final SlotDao slotDao;

  /**
   * Instantiates a new Jdbi key value store.
   *
   * @param jdbi    the jdbi
   * @param slotDao the slot dao
   */
  @Inject
  public JdbiKeyValueStore(final Jdbi jdbi,
                           final SlotDao slotDao) {
    log.info("JdbiKeyValueStore({}, {})", jdbi, slotDao);
    this.jdbi = jdbi;
    this.slotDao = slotDao;
  }

  @Override
  public Optional<String> get(final String name) {
    log.trace("get({})", name);
    return execute("get", () -> slotDao.getContent(name));
  }

  @Override
  public void put(final String name, final String content) {
    log.trace("put({})", name);
    putMany(Map.of(name, content));
  }

  @Override
  public void delete(final String name) {
    log.trace("delete({})", name);
    execute("delete", () -> slotDao.delete(name));
  }

  @Override
  public Map<String, String> getMany(final Collection<String> names) {
    log.trace("getMany({})", names);
    if (names.isEmpty()) {
      return Map.of();
    }
    return execute("getMany", () -> slotDao.getSlots(names).stream()
        .collect(Collectors.toMap(Slot::name, Slot::content)));
  }

  @Override
  public void putMany(final Map<String, String> slots) {
    log.trace("putMany({})", slots.keySet());
    if (slots.isEmpty()) {
      return;
    }
    final List<String> names = new ArrayList<>(slots.keySet());
    final List<String> contents = names.stream().map(slots::get).toList();
    execute("putMany", () -> jdbi.inTransaction(handle -> {
      final SlotDao dao = handle.attach(SlotDao.class);
      dao.deleteAll(names);
      return dao.insertAll(names, contents);
    }));
  }

  @Override
  public void deleteMany(final Collection<String> names) {
    log.trace("deleteMany({})", names);
    if (names.isEmpty()) {
      return;
    }
    execute("deleteMany", () -> jdbi.inTransaction(handle -> handle.attach(SlotDao.class).deleteAll(names)));
  }

  private <T> T execute(final String operation, final Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (JdbiException e) {
      log.error("{} failed", operation, e);
      throw new StorageException("Slot store " + operation + " failed", e);
    }
  }

}
