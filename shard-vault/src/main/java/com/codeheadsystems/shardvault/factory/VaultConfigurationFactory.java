package com.codeheadsystems.shardvault.factory;

import com.codeheadsystems.shardvault.model.VaultConfiguration;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a {@link VaultConfiguration} from JSON.
 */
public class VaultConfigurationFactory {

  private static final Logger log = LoggerFactory.getLogger(VaultConfigurationFactory.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Vault configuration factory.
   */
  public VaultConfigurationFactory() {
    this(new ObjectMapper().registerModule(new Jdk8Module()));
  }

  /**
   * Instantiates a new Vault configuration factory.
   *
   * @param objectMapper the object mapper
   */
  public VaultConfigurationFactory(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * From a file.
   *
   * @param path the path
   * @return the vault configuration
   */
  public VaultConfiguration fromPath(final Path path) {
    log.info("fromPath({})", path);
    try (InputStream inputStream = Files.newInputStream(path)) {
      return read(inputStream);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to read configuration " + path, e);
    }
  }

  /**
   * From a classpath resource.
   *
   * @param resource the resource
   * @return the vault configuration
   */
  public VaultConfiguration fromResource(final String resource) {
    log.info("fromResource({})", resource);
    final InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resource);
    if (inputStream == null) {
      throw new IllegalArgumentException("No configuration resource " + resource);
    }
    try (inputStream) {
      return read(inputStream);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to read configuration " + resource, e);
    }
  }

  /**
   * From a JSON string.
   *
   * @param json the json
   * @return the vault configuration
   */
  public VaultConfiguration fromJson(final String json) {
    try {
      return objectMapper.readValue(json, VaultConfiguration.class);
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid configuration", e);
    }
  }

  private VaultConfiguration read(final InputStream inputStream) throws IOException {
    return objectMapper.readValue(inputStream, VaultConfiguration.class);
  }

}
