package com.codeheadsystems.shardvault.dagger;

import com.codeheadsystems.shardvault.model.VaultConfiguration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * Supplies the caller's configuration to the graph.
 */
@Module
public class ConfigurationModule {

  private final VaultConfiguration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final VaultConfiguration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public VaultConfiguration configuration() {
    return configuration;
  }

}
