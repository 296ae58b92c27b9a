package com.codeheadsystems.shardvault.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryKeyValueStoreTest {

  private InMemoryKeyValueStore store;

  @BeforeEach
  void setup() {
    store = new InMemoryKeyValueStore();
  }

  @Test
  void putGetDelete() {
    assertThat(store.get("a")).isEmpty();
    store.put("a", "1");
    assertThat(store.get("a")).contains("1");
    store.put("a", "2");
    assertThat(store.get("a")).contains("2");
    store.delete("a");
    assertThat(store.get("a")).isEmpty();
    store.delete("a");
  }

  @Test
  void many() {
    store.putMany(Map.of("a", "1", "b", "2", "c", "3"));
    assertThat(store.getMany(List.of("a", "c", "missing"))).containsOnly(Map.entry("a", "1"), Map.entry("c", "3"));
    assertThat(store.containsAll(List.of("a", "b"))).isTrue();
    assertThat(store.containsAll(List.of("a", "missing"))).isFalse();
    assertThat(store.containsAny(List.of("missing", "b"))).isTrue();
    store.deleteMany(List.of("a", "b", "missing"));
    assertThat(store.getMany(List.of("a", "b", "c"))).containsOnlyKeys("c");
    assertThat(store.containsAny(List.of("a", "b"))).isFalse();
  }

}
