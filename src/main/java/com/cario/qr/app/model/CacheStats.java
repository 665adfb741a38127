package com.cario.qr.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Point-in-time snapshot of the artifact cache. */
public record CacheStats(
    @JsonProperty("cached_items") long count,
    @JsonProperty("total_cache_size") long totalBytes,
    @JsonProperty("average_size") double averageBytes) {

  public static CacheStats of(long count, long totalBytes) {
    return new CacheStats(count, totalBytes, count == 0 ? 0.0 : (double) totalBytes / count);
  }
}
