package com.codeheadsystems.shardvault.utilities;

import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Cuts a string into contiguous pieces of ceil(length / count) characters. Trailing pieces may be
 * empty when the string is short. This is a plain partition, not a threshold scheme: every piece
 * is needed to rebuild the string and any piece reveals part of it.
 */
@Singleton
public class ShardSplitter {

  /**
   * Instantiates a new Shard splitter.
   */
  @Inject
  public ShardSplitter() {
  }

  /**
   * Split into exactly count pieces.
   *
   * @param data  the data
   * @param count the number of pieces, at least one.
   * @return the pieces, in order.
   */
  public List<String> split(final String data, final int count) {
    if (count < 1) {
      throw new IllegalArgumentException("Shard count must be at least 1: " + count);
    }
    final int chunkSize = (data.length() + count - 1) / count;
    final List<String> shards = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      final int start = Math.min(i * chunkSize, data.length());
      final int end = Math.min(start + chunkSize, data.length());
      shards.add(data.substring(start, end));
    }
    return shards;
  }

  /**
   * Joins pieces back in order.
   *
   * @param shards the shards
   * @return the string
   */
  public String combine(final List<String> shards) {
    return String.join("", shards);
  }

}
