package com.codeheadsystems.shardvault.dagger;

import com.codeheadsystems.shardvault.SecretVault;
import com.codeheadsystems.shardvault.model.VaultConfiguration;
import com.codeheadsystems.shardvault.store.KeyValueStore;
import dagger.Component;
import javax.inject.Singleton;

/**
 * Builds a vault for one configuration. Construct once at application start.
 */
@Singleton
@Component(modules = {VaultModule.class, ConfigurationModule.class, CommonModule.class})
public interface VaultComponent {

  /**
   * Instance vault component.
   *
   * @param configuration the configuration
   * @return the vault component
   */
  static VaultComponent instance(final VaultConfiguration configuration) {
    return DaggerVaultComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Secret vault.
   *
   * @return the secret vault
   */
  SecretVault secretVault();

  /**
   * Key value store behind the vault.
   *
   * @return the key value store
   */
  KeyValueStore keyValueStore();

}
