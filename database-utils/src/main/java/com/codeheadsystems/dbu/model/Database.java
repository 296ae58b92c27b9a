package com.codeheadsystems.dbu.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.UUID;
import org.immutables.value.Value;

/**
 * Connection settings for the relational store backing persistent slots.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDatabase.class)
@JsonDeserialize(builder = ImmutableDatabase.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Database {

  /**
   * An in-memory HSQLDB database, unique per call.
   *
   * @param name prefix for the database name, usually the caller's simple class name.
   * @return the database
   */
  static Database inMemory(final String name) {
    return ImmutableDatabase.builder()
        .url("jdbc:hsqldb:mem:" + name + ":" + UUID.randomUUID())
        .username("SA")
        .password("")
        .build();
  }

  /**
   * JDBC url.
   *
   * @return the string
   */
  String url();

  /**
   * Database username.
   *
   * @return the string
   */
  String username();

  /**
   * Database password. Never printed by toString().
   *
   * @return the string
   */
  @Value.Redacted
  String password();

  /**
   * Liquibase changelog to run when the Jdbi instance is created. Empty to skip migrations.
   *
   * @return the changelog classpath resource
   */
  @Value.Default
  default String changeLog() {
    return "";
  }

  /**
   * Use postgresql boolean.
   *
   * @return the boolean
   */
  @Value.Derived
  default boolean usePostgresql() {
    return url().startsWith("jdbc:postgresql");
  }

  /**
   * Validate the url looks like jdbc.
   */
  @Value.Check
  default void check() {
    if (!url().startsWith("jdbc:")) {
      throw new IllegalArgumentException("Database url must be a jdbc url");
    }
  }

}
