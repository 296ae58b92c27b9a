package com.codeheadsystems.shardvault.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.shardvault.model.SecretRecord;
import com.codeheadsystems.shardvault.utilities.SlotNames;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SecretRecordConverterTest {

  private static final SecretRecord RECORD = SecretRecord.of("k", "a2V5", List.of("aa", "bb", "c"));

  private final SecretRecordConverter converter = new SecretRecordConverter(new SlotNames("p:", 3, false));

  @Test
  void toSlots() {
    assertThat(converter.toSlots(RECORD)).containsExactly(
        Map.entry("p:k:enckey", "a2V5"),
        Map.entry("p:k:shard:0", "aa"),
        Map.entry("p:k:shard:1", "bb"),
        Map.entry("p:k:shard:2", "c"));
  }

  @Test
  void toSlots_wrongShardCount() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> converter.toSlots(SecretRecord.of("k", "a2V5", List.of("aa"))));
  }

  @Test
  void fromSlots_roundTrip() {
    assertThat(converter.fromSlots("k", converter.toSlots(RECORD))).contains(RECORD);
  }

  @Test
  void fromSlots_missingShard() {
    final Map<String, String> slots = new HashMap<>(converter.toSlots(RECORD));
    slots.remove("p:k:shard:2");
    assertThat(converter.fromSlots("k", slots)).isEmpty();
  }

  @Test
  void fromSlots_missingKey() {
    final Map<String, String> slots = new HashMap<>(converter.toSlots(RECORD));
    slots.remove("p:k:enckey");
    assertThat(converter.fromSlots("k", slots)).isEmpty();
  }

  @Test
  void fromSlots_emptyShardIsPresent() {
    final SecretRecord record = SecretRecord.of("k", "a2V5", List.of("a", "", ""));
    assertThat(converter.fromSlots("k", converter.toSlots(record))).contains(record);
  }

  @Test
  void toString_redactsContent() {
    assertThat(RECORD.toString()).contains("k").doesNotContain("a2V5").doesNotContain("bb");
  }

}
