package com.codeheadsystems.shardvault.model;

import org.immutables.value.Value;

/**
 * A persisted slot row.
 */
@Value.Immutable
public interface Slot {

  /**
   * Of slot.
   *
   * @param name    the name
   * @param content the content
   * @return the slot
   */
  static Slot of(final String name, final String content) {
    return ImmutableSlot.builder().name(name).content(content).build();
  }

  /**
   * Slot name, including the vault prefix.
   *
   * @return the string
   */
  String name();

  /**
   * Slot content.
   *
   * @return the string
   */
  @Value.Redacted
  String content();

}
