package com.codeheadsystems.shardvault.manager;

import com.codeheadsystems.dbu.factory.JdbiFactory;
import com.codeheadsystems.dbu.liquibase.LiquibaseHelper;
import com.codeheadsystems.dbu.model.Database;
import com.codeheadsystems.dbu.model.ImmutableDatabase;
import com.codeheadsystems.shardvault.dagger.VaultModule;
import com.codeheadsystems.shardvault.dao.SlotDao;
import com.codeheadsystems.shardvault.model.Slot;
import com.codeheadsystems.shardvault.store.JdbiKeyValueStore;
import com.codeheadsystems.shardvault.store.KeyValueStore;
import java.util.Set;
import org.jdbi.v3.core.Jdbi;

class ShardedSecretVaultJdbiTest extends BaseShardedSecretVaultTest {

  @Override
  protected KeyValueStore newStore() {
    final Database database = ImmutableDatabase.copyOf(Database.inMemory(getClass().getSimpleName()))
        .withChangeLog(VaultModule.LIQUIBASE_SETUP_XML);
    final Jdbi jdbi = new JdbiFactory(database, Set.of(Slot.class), new LiquibaseHelper()).createJdbi();
    return new JdbiKeyValueStore(jdbi, jdbi.onDemand(SlotDao.class));
  }

}
