package com.codeheadsystems.shardvault.dagger;

import com.codeheadsystems.dbu.factory.JdbiFactory;
import com.codeheadsystems.dbu.model.Database;
import com.codeheadsystems.dbu.model.ImmutableDatabase;
import com.codeheadsystems.shardvault.SecretVault;
import com.codeheadsystems.shardvault.dao.SlotDao;
import com.codeheadsystems.shardvault.manager.ShardedSecretVault;
import com.codeheadsystems.shardvault.model.Slot;
import com.codeheadsystems.shardvault.model.VaultConfiguration;
import com.codeheadsystems.shardvault.store.InMemoryKeyValueStore;
import com.codeheadsystems.shardvault.store.JdbiKeyValueStore;
import com.codeheadsystems.shardvault.store.KeyValueStore;
import com.codeheadsystems.shardvault.utilities.SlotNames;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import java.util.Set;
import javax.inject.Named;
import javax.inject.Provider;
import javax.inject.Singleton;
import org.jdbi.v3.core.Jdbi;

/**
 * The type Vault module.
 */
@Module(includes = VaultModule.Binder.class)
public class VaultModule {

  /**
   * The constant LIQUIBASE_SETUP_XML.
   */
  public static final String LIQUIBASE_SETUP_XML = "shardvault/liquibase-setup.xml";

  /**
   * Instantiates a new Vault module.
   */
  public VaultModule() {
    // Default constructor
  }

  /**
   * Slot names.
   *
   * @param configuration the configuration
   * @return the slot names
   */
  @Provides
  @Singleton
  public SlotNames slotNames(final VaultConfiguration configuration) {
    return new SlotNames(configuration.prefix(), configuration.shardCount(), configuration.completionMarker());
  }

  /**
   * The configured database, migrated with the vault changelog.
   *
   * @param configuration the configuration
   * @return the database
   */
  @Provides
  @Singleton
  public Database database(final VaultConfiguration configuration) {
    return configuration.database()
        .map(database -> (Database) ImmutableDatabase.copyOf(database).withChangeLog(LIQUIBASE_SETUP_XML))
        .orElseThrow(() -> new IllegalStateException("No database configured"));
  }

  /**
   * Immutable classes set.
   *
   * @return the set
   */
  @Provides
  @Singleton
  @Named(JdbiFactory.IMMUTABLES)
  public Set<Class<?>> immutableClasses() {
    return Set.of(Slot.class);
  }

  /**
   * Jdbi.
   *
   * @param factory the factory
   * @return the jdbi
   */
  @Provides
  @Singleton
  public Jdbi jdbi(final JdbiFactory factory) {
    return factory.createJdbi();
  }

  /**
   * Slot dao.
   *
   * @param jdbi the jdbi
   * @return the slot dao
   */
  @Provides
  @Singleton
  public SlotDao slotDao(final Jdbi jdbi) {
    return jdbi.onDemand(SlotDao.class);
  }

  /**
   * The relational store when a database is configured, otherwise in memory.
   *
   * @param configuration the configuration
   * @param jdbiStore     the jdbi store
   * @param memoryStore   the memory store
   * @return the key value store
   */
  @Provides
  @Singleton
  public KeyValueStore keyValueStore(final VaultConfiguration configuration,
                                     final Provider<JdbiKeyValueStore> jdbiStore,
                                     final Provider<InMemoryKeyValueStore> memoryStore) {
    return configuration.database().isPresent() ? jdbiStore.get() : memoryStore.get();
  }

  /**
   * The interface Binder.
   */
  @Module
  interface Binder {

    /**
     * Secret vault.
     *
     * @param vault the vault
     * @return the secret vault
     */
    @Binds
    SecretVault secretVault(ShardedSecretVault vault);

  }
}
